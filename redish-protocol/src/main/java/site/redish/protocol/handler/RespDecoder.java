package site.redish.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.redish.protocol.ProtocolException;
import site.redish.protocol.Resp;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，累积的字节中每出现一个完整的顶层元素
 * 就向下游传递一个{@link Resp}。一次读到的数据可以包含多个流水线命令，
 * 也可以只包含半个元素，剩余部分在下一次读到数据时继续解码。
 *
 * <p>遇到{@link ProtocolException}时丢弃已累积的字节并把异常抛给下游，
 * 由会话处理器负责关闭连接。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    private final int maxLineLength;

    public RespDecoder() {
        this(Resp.DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * @param maxLineLength 未出现行结束符时允许缓存的最大行长度
     */
    public RespDecoder(final int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("最大行长度必须大于0");
        }
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final Resp resp;
            try {
                resp = Resp.decode(in, maxLineLength);
            } catch (ProtocolException e) {
                log.debug("RESP协议错误，丢弃 {} 字节: {}", in.readableBytes(), e.getMessage());
                in.skipBytes(in.readableBytes());
                throw e;
            }
            if (resp == null) {
                // 数据不完整，等待更多数据
                return;
            }
            out.add(resp);
        }
    }
}
