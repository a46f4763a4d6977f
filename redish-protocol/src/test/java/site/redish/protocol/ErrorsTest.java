package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorsTest {

    @Test
    public void testEncode() {
        assertEquals("-ERR syntax error\r\n", encode(new Errors("ERR syntax error")));
    }

    @Test
    public void testLineBreaksReplaced() {
        final Errors errors = new Errors("ERR unknown command 'FOO\r\n:42\r\n+OK'");

        assertEquals("ERR unknown command 'FOO  :42  +OK'", errors.getContent());
        assertEquals("-ERR unknown command 'FOO  :42  +OK'\r\n", encode(errors));
    }

    @Test
    public void testEncodesAsSingleElement() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            new Errors("ERR bad\nvalue\r:1").encode(buf);

            // 整条回复只解码出一个错误元素
            final Resp decoded = Resp.decode(buf);
            assertEquals(RespType.ERROR, decoded.getType());
            assertEquals("ERR bad value :1", ((Errors) decoded).getContent());
            assertFalse(buf.isReadable());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testSimpleStringLineBreaksReplaced() {
        final SimpleString simple = new SimpleString("a\r\n+OK");

        assertEquals("a  +OK", simple.getContent());
        assertEquals("+a  +OK\r\n", encode(simple));
    }

    @Test
    public void testNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Errors(null));
    }

    private static String encode(final Resp resp) {
        final ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }
}
