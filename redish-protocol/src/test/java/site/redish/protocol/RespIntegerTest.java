package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespIntegerTest {

    @Test
    public void testValueOf() {
        // 缓存范围内返回共享实例
        assertSame(RespInteger.ZERO, RespInteger.valueOf(0));
        assertSame(RespInteger.ONE, RespInteger.valueOf(1));
        assertSame(RespInteger.MINUS_ONE, RespInteger.valueOf(-1));
        assertSame(RespInteger.MINUS_TWO, RespInteger.valueOf(-2));

        // 缓存范围外按值相等
        assertEquals(RespInteger.valueOf(1000), RespInteger.valueOf(1000));
        assertEquals(5_000_000_000L, RespInteger.valueOf(5_000_000_000L).getContent());
    }

    @Test
    public void testEncode() {
        assertEquals(":42\r\n", encode(RespInteger.valueOf(42)));
        assertEquals(":-255\r\n", encode(RespInteger.valueOf(-255)));
        assertEquals(":-256\r\n", encode(RespInteger.valueOf(-256)));
        assertEquals(":9223372036854775807\r\n", encode(RespInteger.valueOf(Long.MAX_VALUE)));
    }

    private static String encode(final Resp resp) {
        ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(buf);
            return buf.toString(StandardCharsets.US_ASCII);
        } finally {
            buf.release();
        }
    }
}
