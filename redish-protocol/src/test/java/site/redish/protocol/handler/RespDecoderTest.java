package site.redish.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;
import site.redish.protocol.*;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespDecoderTest {

    private static ByteBuf bufferOf(final String data) {
        return Unpooled.copiedBuffer(data, StandardCharsets.UTF_8);
    }

    @Test
    public void testDecodeSimpleString() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(bufferOf("+OK\r\n")));

        SimpleString result = channel.readInbound();
        assertNotNull(result);
        assertEquals("OK", result.getContent());

        channel.finish();
    }

    @Test
    public void testDecodeCommandArray() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(bufferOf("*3\r\n$4\r\nHSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n")));

        RespArray result = channel.readInbound();
        assertNotNull(result);
        assertEquals(3, result.size());
        assertEquals("HSET", result.getContent()[0].toString());
        assertEquals("bar", result.getContent()[2].toString());

        channel.finish();
    }

    @Test
    public void testDecodePipelinedCommands() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 一次读到多个命令
        assertTrue(channel.writeInbound(bufferOf("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n:5\r\n")));

        RespArray ping = channel.readInbound();
        RespArray get = channel.readInbound();
        RespInteger five = channel.readInbound();
        assertEquals("PING", ping.getContent()[0].toString());
        assertEquals("k", get.getContent()[1].toString());
        assertEquals(5, five.getContent());
        assertNull(channel.readInbound());

        channel.finish();
    }

    @Test
    public void testDecodeAcrossMultipleReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertFalse(channel.writeInbound(bufferOf("*2\r\n$3\r\nG")));
        assertNull(channel.readInbound(), "数据不完整时不应输出");
        assertFalse(channel.writeInbound(bufferOf("ET\r\n$3\r")));
        assertTrue(channel.writeInbound(bufferOf("\nkey\r\n")));

        RespArray result = channel.readInbound();
        assertEquals("GET", result.getContent()[0].toString());
        assertEquals("key", result.getContent()[1].toString());

        channel.finish();
    }

    @Test
    public void testDecodeNullBulkString() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(bufferOf("$-1\r\n")));

        BulkString result = channel.readInbound();
        assertTrue(result.isNull());

        channel.finish();
    }

    @Test
    public void testProtocolErrorIsPropagated() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        DecoderException e = assertThrows(DecoderException.class,
                () -> channel.writeInbound(bufferOf("!oops\r\n")));
        assertTrue(e.getCause() instanceof ProtocolException);

        channel.finishAndReleaseAll();
    }

    @Test
    public void testValidFramesBeforeProtocolErrorAreDelivered() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertThrows(DecoderException.class, () -> channel.writeInbound(bufferOf("+first\r\n$-5\r\n")));

        SimpleString first = channel.readInbound();
        assertEquals("first", first.getContent());
        assertNull(channel.readInbound());

        channel.finishAndReleaseAll();
    }

    @Test
    public void testRejectsNonPositiveLineLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RespDecoder(0));
    }
}
