package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis简单字符串类型
 *
 * <p>单行文本回复，不能包含CR或LF。常用回复使用预定义常量。
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    public SimpleString(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("简单字符串内容不能为null");
        }
        this.content = singleLine(content);
    }

    /**
     * 工厂方法：常用内容返回缓存实例。
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
