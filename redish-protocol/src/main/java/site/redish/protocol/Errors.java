package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis错误消息类型
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-ERR unknown command 'foobar'"</li>
 *     <li>示例："-WRONGTYPE Operation against a key holding the wrong kind of value"</li>
 * </ul>
 *
 * <p>消息中的CR、LF被替换为空格。
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("错误消息不能为null");
        }
        this.content = singleLine(content);
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
