package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.redish.datastructure.RedisBytes;

/**
 * Redis批量字符串类型
 *
 * <p>长度前缀的二进制安全字符串。内容为null时表示null批量字符串
 * （线路上的"$-1\r\n"），与空字符串"$0\r\n\r\n"不同。
 *
 * <p>使用建议：
 * <ul>
 *     <li>优先使用工厂方法而非构造函数</li>
 *     <li>内部解码使用wrapTrusted避免复制</li>
 *     <li>外部数据使用create确保安全性</li>
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    /** null批量字符串的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** null批量字符串 */
    public static final BulkString NULL = new BulkString(null);

    /** 字符串内容，null表示null批量字符串 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 安全模式工厂方法，会复制输入数组。
     *
     * @param content 字节数组内容
     * @return BulkString实例，输入为null时返回{@link #NULL}
     */
    public static BulkString create(final byte[] content) {
        return content == null ? NULL : new BulkString(new RedisBytes(content));
    }

    /**
     * 基于RedisBytes创建。
     *
     * @param content RedisBytes内容
     * @return BulkString实例，输入为null时返回{@link #NULL}
     */
    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法，调用者必须保证数组不会再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return trustedBytes == null ? NULL : new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    /**
     * 以UTF-8编码的字符串创建。
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        return str == null ? NULL : new BulkString(RedisBytes.fromString(str));
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    @Override
    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize(bytes.length));
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 估算编码后的大小，用于 ByteBuf 预分配
     *
     * @param contentLength 内容长度
     * @return 估算的编码大小
     */
    static int estimateEncodedSize(final int contentLength) {
        // '$' + 长度数字 + '\r\n' + 内容 + '\r\n'
        return 1 + String.valueOf(contentLength).length() + 2 + contentLength + 2;
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，null批量字符串返回 null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
