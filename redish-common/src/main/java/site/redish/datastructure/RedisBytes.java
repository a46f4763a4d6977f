package site.redish.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节序列，用作键、字段和值的统一表示。
 *
 * <p>Redis的键和值都是任意字节，不一定是合法的UTF-8文本，因此存储层
 * 和协议层都使用本类而不是{@link String}：
 * <ul>
 *   <li>按字节内容比较相等性，可直接作为{@code ConcurrentHashMap}的键
 *   <li>哈希值在构造时预先计算
 *   <li>字符串形式延迟解码并缓存
 *   <li>{@link #wrapTrusted(byte[])}为解码器等可信路径提供零拷贝构造
 * </ul>
 *
 * <p>线程安全性：实例不可变，可在线程间自由共享。
 *
 * @author redish
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /** 文本与字节互转使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节序列 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /** 构造时缓存字符串形式的最大长度 */
    private static final int MAX_CACHED_STRING_SIZE = 128;

    private final byte[] bytes;

    private final int hashCode;

    private volatile String stringValue;

    /**
     * 复制输入数组创建实例。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝工厂方法。
     *
     * <p><b>警告</b>：调用者必须保证数组此后不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 以UTF-8编码字符串。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        if (str.length() <= MAX_CACHED_STRING_SIZE) {
            redisBytes.stringValue = str;
        }
        return redisBytes;
    }

    /**
     * 以十进制文本表示整数，INCR等命令使用。
     *
     * @param value 整数值
     * @return 十进制文本的字节序列
     */
    public static RedisBytes fromLong(final long value) {
        return fromString(Long.toString(value));
    }

    /**
     * 获取字节数组的副本。
     *
     * @return 字节数组副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改返回的数组。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取UTF-8解码后的字符串，结果会被缓存。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 按ASCII规则忽略大小写比较。
     *
     * @param other 另一个RedisBytes
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * 返回ASCII字母转为大写后的副本，命令查找使用。
     *
     * @return 大写形式，本身已是大写时返回this
     */
    public RedisBytes toUpperCase() {
        byte[] upper = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            if (b >= 'a' && b <= 'z') {
                if (upper == null) {
                    upper = bytes.clone();
                }
                upper[i] = (byte) (b - 32);
            }
        }
        return upper == null ? this : new RedisBytes(upper, true);
    }

    private static byte toLower(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    /**
     * 获取字节长度。
     *
     * @return 字节长度
     */
    public int length() {
        return bytes.length;
    }

    /**
     * 是否为空序列。
     *
     * @return 长度为0时返回true
     */
    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 按无符号字节字典序比较，前缀较短者在前。
     */
    @Override
    public int compareTo(final RedisBytes other) {
        if (this == other) {
            return 0;
        }
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length);
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        }
        sb.append("]");
        return sb.toString();
    }
}
