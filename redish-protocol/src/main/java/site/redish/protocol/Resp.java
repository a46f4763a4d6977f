package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Redis协议基础类
 *
 * <p>所有RESP元素的基类，负责RESP2协议的解码并定义统一的编码接口。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头，64位有符号</li>
 *     <li>批量字符串 - 以"$"开头，长度-1表示null</li>
 *     <li>数组 - 以"*"开头，长度-1表示null</li>
 * </ul>
 *
 * <p>解码是可恢复的：缓冲区中的数据不足一个完整元素时，读索引回滚到
 * 调用前的位置并返回null，调用方在收到更多字节后从头重试。语法错误则
 * 抛出{@link ProtocolException}。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 未找到行结束符时允许缓存的最大行长度 */
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    private static final int MAX_CACHED_NUMBER = 255;

    private static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;
    private static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;
    private static final int PROTO_MAX_NESTING = 128;

    /** 数据不完整的信号，不携带堆栈 */
    private static final NeedMoreData NEED_MORE_DATA = new NeedMoreData();

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 以十进制写入整数，常用小数字走缓存。
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 使用默认行长度上限解码一个元素。
     *
     * @param buffer 输入缓冲区
     * @return 解码后的元素，数据不完整时返回null
     * @throws ProtocolException 数据不符合RESP语法时
     */
    public static Resp decode(final ByteBuf buffer) {
        return decode(buffer, DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * RESP 协议解码方法
     *
     * @param buffer 输入缓冲区
     * @param maxLineLength 未出现行结束符时允许的最大行长度
     * @return 解码后的元素，数据不完整时返回null且读索引不变
     * @throws ProtocolException 数据不符合RESP语法时，读索引不变
     */
    public static Resp decode(final ByteBuf buffer, final int maxLineLength) {
        if (!buffer.isReadable()) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeElement(buffer, maxLineLength, 0);
        } catch (NeedMoreData e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeElement(final ByteBuf buffer, final int maxLineLength, final int depth) {
        if (!buffer.isReadable()) {
            throw NEED_MORE_DATA;
        }
        final byte typeIndicator = buffer.readByte();
        switch ((char) typeIndicator) {
            case '+':
                return new SimpleString(getString(buffer, maxLineLength));
            case '-':
                return new Errors(getString(buffer, maxLineLength));
            case ':':
                return RespInteger.valueOf(getNumber(buffer, maxLineLength));
            case '$':
                return decodeBulkString(buffer, maxLineLength);
            case '*':
                return decodeArray(buffer, maxLineLength, depth);
            default:
                log.warn("无法识别的RESP类型标识: 字节值 {}", typeIndicator & 0xFF);
                throw new ProtocolException("unknown type tag '" + printable(typeIndicator) + "'");
        }
    }

    private static BulkString decodeBulkString(final ByteBuf buffer, final int maxLineLength) {
        final long length = getNumber(buffer, maxLineLength);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0) {
            throw new ProtocolException("invalid bulk length " + length);
        }
        if (length > PROTO_MAX_BULK_LEN) {
            throw new ProtocolException("invalid bulk length " + length);
        }
        final int size = (int) length;
        if (buffer.readableBytes() < size + 2) {
            throw NEED_MORE_DATA;
        }
        final byte[] content = new byte[size];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    private static RespArray decodeArray(final ByteBuf buffer, final int maxLineLength, final int depth) {
        final long count = getNumber(buffer, maxLineLength);
        if (count == -1) {
            return RespArray.NULL;
        }
        if (count < 0 || count > PROTO_MAX_ARRAY_LEN) {
            throw new ProtocolException("invalid multibulk length " + count);
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }
        if (depth >= PROTO_MAX_NESTING) {
            throw new ProtocolException("array nesting too deep");
        }
        final Resp[] array = new Resp[(int) count];
        for (int i = 0; i < array.length; i++) {
            array[i] = decodeElement(buffer, maxLineLength, depth + 1);
        }
        return new RespArray(array);
    }

    /**
     * 定位当前行的'\r'位置，不移动读索引。
     */
    private static int findLineEnd(final ByteBuf buffer, final int maxLineLength) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0) {
            if (buffer.writerIndex() - startIndex > maxLineLength) {
                throw new ProtocolException("too big line");
            }
            throw NEED_MORE_DATA;
        }
        if (endIndex - startIndex > maxLineLength) {
            throw new ProtocolException("too big line");
        }
        if (endIndex + 1 >= buffer.writerIndex()) {
            throw NEED_MORE_DATA;
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new ProtocolException("expected LF after CR");
        }
        return endIndex;
    }

    /**
     * 读取到 \r\n 为止的文本，用于简单字符串和错误消息。
     */
    static String getString(final ByteBuf buffer, final int maxLineLength) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer, maxLineLength);
        final String result = buffer.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        buffer.readerIndex(endIndex + 2);
        return result;
    }

    /**
     * 读取到 \r\n 为止的64位有符号十进制整数，用于整数和长度前缀。
     */
    static long getNumber(final ByteBuf buffer, final int maxLineLength) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer, maxLineLength);
        if (endIndex == startIndex) {
            throw new ProtocolException("invalid integer: empty");
        }

        int i = startIndex;
        final boolean negative = buffer.getByte(i) == '-';
        if (negative) {
            i++;
            if (i == endIndex) {
                throw new ProtocolException("invalid integer: '-'");
            }
        }

        // 按负数累加，才能表示Long.MIN_VALUE
        final long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        final long multmin = limit / 10;
        long value = 0;
        for (; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid integer: non-digit character");
            }
            final int digit = b - '0';
            if (value < multmin) {
                throw new ProtocolException("invalid integer: out of range");
            }
            value *= 10;
            if (value < limit + digit) {
                throw new ProtocolException("invalid integer: out of range");
            }
            value -= digit;
        }

        buffer.readerIndex(endIndex + 2);
        return negative ? value : -value;
    }

    private static String printable(final byte b) {
        return b >= 32 && b <= 126 ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xFF);
    }

    /**
     * 把单行回复中的CR、LF替换为空格，保证一条回复只占一行。
     *
     * @param text 回复文本
     * @return 不含CR、LF的文本
     */
    protected static String singleLine(final String text) {
        if (text.indexOf('\r') < 0 && text.indexOf('\n') < 0) {
            return text;
        }
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * 元素的声明类型。
     *
     * @return 类型标签
     */
    public abstract RespType getType();

    /**
     * 是否为长度-1的null形式。
     *
     * @return 只有null批量字符串和null数组返回true
     */
    public boolean isNull() {
        return false;
    }

    /**
     * 按RESP格式写入缓冲区。
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    private static final class NeedMoreData extends RuntimeException {
        private NeedMoreData() {
            super("incomplete frame", null, false, false);
        }
    }
}
