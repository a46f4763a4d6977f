package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Redis数组类型
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 预定义的null数组实例 */
    public static final RespArray NULL = new RespArray(null);

    /** 数组内容，null表示null数组 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    /**
     * 工厂方法：空数组和null数组返回缓存实例。
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 由元素列表创建数组。
     *
     * @param elements 元素列表
     * @return RespArray 实例
     */
    public static RespArray of(final List<? extends Resp> elements) {
        return valueOf(elements.toArray(new Resp[0]));
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    @Override
    public boolean isNull() {
        return content == null;
    }

    /**
     * 元素个数，null数组返回-1。
     *
     * @return 元素个数
     */
    public int size() {
        return content == null ? -1 : content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return content == null ? "null" : Arrays.toString(content);
    }
}
