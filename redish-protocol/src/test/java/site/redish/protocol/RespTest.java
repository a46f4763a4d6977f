package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RespTest {

    private static ByteBuf bufferOf(final String data) {
        return Unpooled.copiedBuffer(data, StandardCharsets.ISO_8859_1);
    }

    private static String encodeToString(final Resp resp) {
        ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(buf);
            return buf.toString(StandardCharsets.ISO_8859_1);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeSimpleString() {
        ByteBuf buf = bufferOf("+OK\r\n");
        try {
            Resp resp = Resp.decode(buf);
            assertTrue(resp instanceof SimpleString);
            assertEquals("OK", ((SimpleString) resp).getContent());
            assertFalse(buf.isReadable(), "应消费完整的帧");
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeError() {
        ByteBuf buf = bufferOf("-ERR something bad\r\n");
        try {
            Resp resp = Resp.decode(buf);
            assertTrue(resp instanceof Errors);
            assertEquals("ERR something bad", ((Errors) resp).getContent());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeIntegerLimits() {
        ByteBuf buf = bufferOf(":9223372036854775807\r\n:-9223372036854775808\r\n:0\r\n");
        try {
            assertEquals(Long.MAX_VALUE, ((RespInteger) Resp.decode(buf)).getContent());
            assertEquals(Long.MIN_VALUE, ((RespInteger) Resp.decode(buf)).getContent());
            assertSame(RespInteger.ZERO, Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {":abc\r\n", ":\r\n", ":-\r\n", ":12a\r\n", ":9223372036854775808\r\n",
            ":-9223372036854775809\r\n"})
    public void testDecodeInvalidIntegerFails(final String frame) {
        ByteBuf buf = bufferOf(frame);
        try {
            assertThrows(ProtocolException.class, () -> Resp.decode(buf));
            assertEquals(0, buf.readerIndex(), "出错时读索引应回滚");
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeBulkString() {
        ByteBuf buf = bufferOf("$5\r\nhello\r\n");
        try {
            Resp resp = Resp.decode(buf);
            assertTrue(resp instanceof BulkString);
            assertEquals("hello", resp.toString());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeBinaryBulkString() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeBytes("$4\r\n".getBytes(StandardCharsets.US_ASCII));
        buf.writeBytes(new byte[]{'\r', '\n', 0, (byte) 0xFF});
        buf.writeBytes(Resp.CRLF);
        try {
            BulkString resp = (BulkString) Resp.decode(buf);
            assertArrayEquals(new byte[]{'\r', '\n', 0, (byte) 0xFF}, resp.getContent().getBytes());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testNullAndEmptyBulkStringAreDistinct() {
        ByteBuf buf = bufferOf("$-1\r\n$0\r\n\r\n");
        try {
            BulkString nullBulk = (BulkString) Resp.decode(buf);
            BulkString emptyBulk = (BulkString) Resp.decode(buf);

            assertTrue(nullBulk.isNull());
            assertNull(nullBulk.getContent());
            assertFalse(emptyBulk.isNull());
            assertEquals(0, emptyBulk.getContent().length());
            assertNotEquals(nullBulk, emptyBulk);
            assertEquals(RespType.NULL, RespType.of(nullBulk));
            assertEquals(RespType.BULK_STRING, RespType.of(emptyBulk));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testNullBulkStringConsumesOnlyHeader() {
        ByteBuf buf = bufferOf("$-1\r\n+OK\r\n");
        try {
            assertSame(BulkString.NULL, Resp.decode(buf));
            assertEquals(SimpleString.OK, Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"$-2\r\n", "$-100\r\n", "$3\r\nabcde", "$536870913\r\n"})
    public void testDecodeInvalidBulkStringFails(final String frame) {
        ByteBuf buf = bufferOf(frame);
        try {
            assertThrows(ProtocolException.class, () -> Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testDecodeArray() {
        ByteBuf buf = bufferOf("*3\r\n$4\r\nHSET\r\n:7\r\n*1\r\n+x\r\n");
        try {
            RespArray array = (RespArray) Resp.decode(buf);
            assertEquals(3, array.size());
            assertEquals("HSET", array.getContent()[0].toString());
            assertEquals(RespInteger.valueOf(7), array.getContent()[1]);
            assertEquals(new RespArray(new Resp[]{new SimpleString("x")}), array.getContent()[2]);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testNullAndEmptyArrayAreDistinct() {
        ByteBuf buf = bufferOf("*-1\r\n*0\r\n");
        try {
            Resp nullArray = Resp.decode(buf);
            Resp emptyArray = Resp.decode(buf);

            assertSame(RespArray.NULL, nullArray);
            assertSame(RespArray.EMPTY, emptyArray);
            assertTrue(nullArray.isNull());
            assertFalse(emptyArray.isNull());
            assertNotEquals(nullArray, emptyArray);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testArrayWithNullElements() {
        ByteBuf buf = bufferOf("*2\r\n$-1\r\n*-1\r\n");
        try {
            RespArray array = (RespArray) Resp.decode(buf);
            assertSame(BulkString.NULL, array.getContent()[0]);
            assertSame(RespArray.NULL, array.getContent()[1]);
        } finally {
            buf.release();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"*-2\r\n", "*1048577\r\n", "?\r\n", "\r\n", "hello\r\n"})
    public void testDecodeInvalidHeaderFails(final String frame) {
        ByteBuf buf = bufferOf(frame);
        try {
            assertThrows(ProtocolException.class, () -> Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testIncompleteDataReturnsNullAndKeepsReaderIndex() {
        ByteBuf buf = bufferOf("*2\r\n$3\r\nfoo\r\n$3\r\nba");
        try {
            assertNull(Resp.decode(buf));
            assertEquals(0, buf.readerIndex());

            buf.writeBytes("r\r\n".getBytes(StandardCharsets.US_ASCII));
            RespArray array = (RespArray) Resp.decode(buf);
            assertEquals("bar", array.getContent()[1].toString());
        } finally {
            buf.release();
        }
    }

    @Test
    public void testEmptyBufferReturnsNull() {
        ByteBuf buf = Unpooled.buffer();
        try {
            assertNull(Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testOverlongLineWithoutTerminatorFails() {
        char[] payload = new char[100];
        Arrays.fill(payload, 'a');
        ByteBuf buf = bufferOf("+" + new String(payload));
        try {
            assertThrows(ProtocolException.class, () -> Resp.decode(buf, 64));
        } finally {
            buf.release();
        }

        ByteBuf shortLine = bufferOf("+aaaa");
        try {
            assertNull(Resp.decode(shortLine, 64), "未超过上限时应等待更多数据");
        } finally {
            shortLine.release();
        }
    }

    @Test
    public void testDeeplyNestedArrayFails() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            sb.append("*1\r\n");
        }
        sb.append(":1\r\n");
        ByteBuf buf = bufferOf(sb.toString());
        try {
            assertThrows(ProtocolException.class, () -> Resp.decode(buf));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testNullBulkStringRoundTripIsByteExact() {
        ByteBuf buf = bufferOf("$-1\r\n");
        try {
            Resp resp = Resp.decode(buf);
            assertTrue(resp.isNull());
            assertEquals("$-1\r\n", encodeToString(resp));
        } finally {
            buf.release();
        }
    }

    @Test
    public void testEncodeDecodeRoundTrip() {
        Resp[] samples = {
                SimpleString.OK,
                new Errors("WRONGTYPE Operation against a key holding the wrong kind of value"),
                RespInteger.valueOf(Long.MIN_VALUE),
                RespInteger.valueOf(-300),
                BulkString.fromString("hello"),
                BulkString.fromString(""),
                BulkString.NULL,
                RespArray.EMPTY,
                RespArray.NULL,
                new RespArray(new Resp[]{BulkString.NULL, RespArray.EMPTY, RespInteger.ONE,
                        new RespArray(new Resp[]{new SimpleString("nested")})})
        };
        for (Resp sample : samples) {
            ByteBuf buf = Unpooled.buffer();
            try {
                sample.encode(buf);
                assertEquals(sample, Resp.decode(buf), "往返结果应相等: " + sample);
                assertFalse(buf.isReadable());
            } finally {
                buf.release();
            }
        }
    }

    @Test
    public void testDecodeSplitAtEveryBoundary() {
        Resp command = new RespArray(new Resp[]{
                BulkString.fromString("HSET"), BulkString.fromString("foo"),
                BulkString.fromString("bar"), BulkString.fromString(""), BulkString.NULL,
                RespInteger.valueOf(-42), new SimpleString("ok"), RespArray.NULL});
        byte[] encoded = encodeToString(command).getBytes(StandardCharsets.ISO_8859_1);

        for (int split = 0; split <= encoded.length; split++) {
            ByteBuf buf = Unpooled.buffer();
            try {
                buf.writeBytes(encoded, 0, split);
                Resp first = Resp.decode(buf);
                if (split < encoded.length) {
                    assertNull(first, "前 " + split + " 字节不应解码出元素");
                    assertEquals(0, buf.readerIndex());
                    buf.writeBytes(encoded, split, encoded.length - split);
                    first = Resp.decode(buf);
                }
                assertEquals(command, first, "在第 " + split + " 字节处拆分后结果应一致");
            } finally {
                buf.release();
            }
        }
    }
}
