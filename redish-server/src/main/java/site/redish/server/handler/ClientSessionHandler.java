package site.redish.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import site.redish.protocol.ProtocolException;
import site.redish.protocol.Resp;
import site.redish.server.event.ConnectionEvent;
import site.redish.server.event.RespDataEvent;
import site.redish.server.event.RespEventPublisher;
import site.redish.server.session.ClientSession;
import site.redish.server.session.SessionManager;
import site.redish.server.session.SessionState;

import java.io.IOException;

/**
 * 连接会话处理器，每个通道一个实例。
 *
 * <p>职责：
 * <ul>
 *   <li>通道注册时创建会话，激活时进入ESTABLISHED并发布连接事件
 *   <li>每个解码出的顶层元素发布一个数据事件，再交给命令执行
 *   <li>协议错误和I/O错误时会话进入FAULTED，异常继续传递给命令处理器，
 *       由它在已排队的回复之后写出错误并关闭连接
 *   <li>通道关闭时会话进入CLOSED并发布断开事件
 * </ul>
 *
 * <p>运行在通道的I/O线程上。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class ClientSessionHandler extends ChannelInboundHandlerAdapter {

    /** 通道上保存会话的属性 */
    public static final AttributeKey<ClientSession> SESSION = AttributeKey.valueOf("redish.session");

    private final SessionManager sessionManager;

    private final RespEventPublisher publisher;

    private ClientSession session;

    public ClientSessionHandler(final SessionManager sessionManager, final RespEventPublisher publisher) {
        this.sessionManager = sessionManager;
        this.publisher = publisher;
    }

    @Override
    public void channelRegistered(final ChannelHandlerContext ctx) throws Exception {
        session = sessionManager.create(ctx.channel());
        ctx.channel().attr(SESSION).set(session);
        super.channelRegistered(ctx);
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        if (session.transitionTo(SessionState.ESTABLISHED)) {
            publisher.publishConnected(new ConnectionEvent(session.getId(),
                    ConnectionEvent.Kind.CONNECTED, ctx.channel().remoteAddress()));
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
        if (session.getState() != SessionState.ESTABLISHED) {
            log.debug("会话 {} 状态为 {}，丢弃消息", session.getId(), session.getState());
            return;
        }
        if (msg instanceof Resp) {
            publisher.publishData(new RespDataEvent(session.getId(), (Resp) msg));
        }
        ctx.fireChannelRead(msg);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        // 对端主动断开
        session.transitionTo(SessionState.CLOSING);
        session.transitionTo(SessionState.CLOSED);
        sessionManager.remove(session);
        publisher.publishDisconnected(new ConnectionEvent(session.getId(),
                ConnectionEvent.Kind.DISCONNECTED, ctx.channel().remoteAddress()));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) throws Exception {
        final Throwable rootCause = unwrap(cause);
        if (rootCause instanceof ProtocolException) {
            log.warn("会话 {} 协议错误: {}", session.getId(), rootCause.getMessage());
        } else if (rootCause instanceof IOException) {
            log.info("会话 {} I/O错误: {}", session.getId(), rootCause.getMessage());
        } else {
            log.error("会话 {} 发生异常", session.getId(), rootCause);
        }
        if (!session.transitionTo(SessionState.FAULTED)) {
            // 已经在关闭或已出错，不再重复回复
            ctx.close();
            return;
        }
        ctx.fireExceptionCaught(rootCause);
    }

    static Throwable unwrap(final Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() != null) {
            return cause.getCause();
        }
        return cause;
    }
}
