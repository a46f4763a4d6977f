package site.redish.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;

/**
 * RESP协议编码器
 *
 * <p>把{@link Resp}回复写成RESP字节。编码前按回复类型估算大小并预先
 * 扩容输出缓冲区，减少扩容次数。编码器无状态，可在连接之间共享。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(out);
        if (log.isTraceEnabled()) {
            log.trace("编码RESP响应: {} ({} bytes)", msg.getType(), out.readableBytes());
        }
    }

    /**
     * 估算RESP消息编码后的大小。
     *
     * @param msg RESP消息对象
     * @return 估算的编码大小（字节数）
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            return bulkString.isNull() ? 5 : bulkString.getContent().length() + 16;
        }
        if (msg instanceof RespArray) {
            final RespArray array = (RespArray) msg;
            if (array.isNull()) {
                return 5;
            }
            int totalSize = 16;
            for (final Resp element : array.getContent()) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 32;
    }
}
