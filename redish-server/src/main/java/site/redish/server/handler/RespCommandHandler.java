package site.redish.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.redish.command.CommandDispatcher;
import site.redish.protocol.Errors;
import site.redish.protocol.ProtocolException;
import site.redish.protocol.Resp;
import site.redish.server.session.ClientSession;

/**
 * Redis命令处理器，负责执行客户端请求并写回响应。
 *
 * <p>运行在命令执行线程组上，每个通道固定绑定一个执行线程，
 * 同一连接的回复顺序与请求顺序一致。
 *
 * <p>上游传来的协议错误在这里处理：先写出{@code -ERR Protocol error: ...}，
 * 刷新后关闭连接。其他异常直接关闭连接。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final ClientSession session = ctx.channel().attr(ClientSessionHandler.SESSION).get();
        final Resp response = dispatcher.dispatch(session, msg);
        if (!ctx.channel().isActive()) {
            log.debug("Channel 已关闭，跳过响应发送");
            return;
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        final Throwable rootCause = ClientSessionHandler.unwrap(cause);
        if (rootCause instanceof ProtocolException && ctx.channel().isActive()) {
            ctx.writeAndFlush(new Errors("ERR Protocol error: " + rootCause.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.close();
        }
    }
}
