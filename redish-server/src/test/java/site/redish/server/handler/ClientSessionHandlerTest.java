package site.redish.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import site.redish.command.CommandTestSupport;
import site.redish.protocol.RespType;
import site.redish.protocol.handler.RespDecoder;
import site.redish.protocol.handler.RespEncoder;
import site.redish.server.event.ConnectionEvent;
import site.redish.server.event.RespDataEvent;
import site.redish.server.event.RespEventPublisher;
import site.redish.server.event.RespListener;
import site.redish.server.session.ClientSession;
import site.redish.server.session.SessionState;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ClientSessionHandlerTest extends CommandTestSupport {

    @Mock
    private RespListener listener;

    private RespEventPublisher publisher;

    private EmbeddedChannel channel;

    private ClientSession channelSession;

    @BeforeEach
    void setUpChannel() {
        publisher = new RespEventPublisher();
        publisher.addListener(listener);

        // 测试中命令处理器直接运行在EmbeddedChannel的线程上
        channel = new EmbeddedChannel(
                new RespDecoder(),
                new RespEncoder(),
                new ClientSessionHandler(sessionManager, publisher),
                new RespCommandHandler(dispatcher));
        channelSession = channel.attr(ClientSessionHandler.SESSION).get();
    }

    @AfterEach
    void closeChannel() {
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("通道激活后会话进入ESTABLISHED并发布连接事件")
    void testConnectedEvent() {
        assertNotNull(channelSession);
        assertEquals(SessionState.ESTABLISHED, channelSession.getState());
        assertSame(channelSession, sessionManager.get(channelSession.getId()));

        final ArgumentCaptor<ConnectionEvent> captor = ArgumentCaptor.forClass(ConnectionEvent.class);
        verify(listener).onConnected(captor.capture());
        assertEquals(channelSession.getId(), captor.getValue().getSessionId());
        assertEquals(ConnectionEvent.Kind.CONNECTED, captor.getValue().getKind());
    }

    @Test
    @DisplayName("请求得到回复并发布数据事件")
    void testRequestReplyAndDataEvent() {
        writeInbound("*3\r\n$4\r\nHSET\r\n$6\r\nuser:1\r\n$4\r\nname\r\n");
        // 请求不完整，没有回复
        assertNull(channel.readOutbound());

        writeInbound("$5\r\nalice\r\n");
        assertEquals(":1\r\n", readReply());

        final ArgumentCaptor<RespDataEvent> captor = ArgumentCaptor.forClass(RespDataEvent.class);
        verify(listener).onDataReceived(captor.capture());
        assertEquals(channelSession.getId(), captor.getValue().getSessionId());
        assertEquals(RespType.ARRAY, captor.getValue().getType());
    }

    @Test
    @DisplayName("流水线请求按顺序回复")
    void testPipelinedRequests() {
        writeInbound("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n");

        assertEquals("+PONG\r\n", readReply());
        assertEquals("$-1\r\n", readReply());
        assertEquals("$2\r\nhi\r\n", readReply());
        assertNull(channel.readOutbound());
    }

    @Test
    @DisplayName("命令错误不关闭连接")
    void testCommandErrorKeepsConnectionOpen() {
        writeInbound("*1\r\n$7\r\nUNKNOWN\r\n");
        assertEquals("-ERR unknown command 'UNKNOWN'\r\n", readReply());

        assertTrue(channel.isActive());
        writeInbound("*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", readReply());
    }

    @Test
    @DisplayName("协议错误先回复已解码请求，再回复错误并关闭连接")
    void testProtocolErrorClosesConnection() {
        writeInbound("*1\r\n$4\r\nPING\r\n!oops\r\n");

        assertEquals("+PONG\r\n", readReply());
        assertTrue(readReply().startsWith("-ERR Protocol error: "));
        assertFalse(channel.isActive());

        // 连接关闭后会话被注销
        assertEquals(SessionState.CLOSED, channelSession.getState());
        assertNull(sessionManager.get(channelSession.getId()));
        verify(listener).onDisconnected(any(ConnectionEvent.class));
    }

    @Test
    @DisplayName("非数组请求返回错误但不关闭连接")
    void testNonArrayRequest() {
        writeInbound("+PING\r\n");
        assertEquals("-ERR Protocol error: expected array of bulk strings\r\n", readReply());
        assertTrue(channel.isActive());
    }

    @Test
    @DisplayName("对端关闭后会话进入CLOSED")
    void testChannelClose() {
        channel.close();

        assertEquals(SessionState.CLOSED, channelSession.getState());
        assertNull(sessionManager.get(channelSession.getId()));

        final ArgumentCaptor<ConnectionEvent> captor = ArgumentCaptor.forClass(ConnectionEvent.class);
        verify(listener).onDisconnected(captor.capture());
        assertEquals(ConnectionEvent.Kind.DISCONNECTED, captor.getValue().getKind());
    }

    @Test
    void testUnwrap() {
        final IllegalStateException cause = new IllegalStateException("boom");
        assertSame(cause, ClientSessionHandler.unwrap(new DecoderException(cause)));
        assertSame(cause, ClientSessionHandler.unwrap(cause));
    }

    private void writeInbound(final String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    private String readReply() {
        final ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "expected a reply");
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }
}
