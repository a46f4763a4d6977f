package site.redish.datastructure;

import site.redish.exception.InvalidArgumentException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;

/**
 * Redis字符串数据结构实现类
 *
 * <p>二进制安全的字符串值。所有读写方法在实例上同步，APPEND、INCRBY等
 * 读-改-写操作对同一个键的并发调用是原子的。
 *
 * <p>主要功能包括：
 * <ul>
 *     <li>字符串的存储和获取</li>
 *     <li>追加和截取子串（APPEND/GETRANGE）</li>
 *     <li>数值的增减（INCR/INCRBY/DECR/DECRBY/INCRBYFLOAT）</li>
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisString implements RedisData {

    /** 能按整数解析的最大字节数 */
    private static final int MAX_LONG_CHARS = 20;

    /** 能按小数解析的最大字节数 */
    private static final int MAX_DECIMAL_CHARS = 5120;

    /** 小数结果保留的有效数字 */
    private static final MathContext DECIMAL_PRECISION = new MathContext(17);

    private volatile long timeout = -1;

    private RedisBytes value;

    public RedisString(final RedisBytes value) {
        if (value == null) {
            throw new InvalidArgumentException("string value must not be null");
        }
        this.value = value;
    }

    @Override
    public RedisDataType getType() {
        return RedisDataType.STRING;
    }

    @Override
    public long timeout() {
        return timeout;
    }

    @Override
    public void setTimeout(final long timeout) {
        this.timeout = timeout;
    }

    public synchronized RedisBytes getValue() {
        return value;
    }

    public synchronized void setValue(final RedisBytes value) {
        if (value == null) {
            throw new InvalidArgumentException("string value must not be null");
        }
        this.value = value;
    }

    /**
     * 字节长度
     *
     * @return 字节长度
     */
    public synchronized int length() {
        return value.length();
    }

    /**
     * 在末尾追加内容
     *
     * @param suffix 追加的内容
     * @return 追加后的字节长度
     */
    public synchronized int append(final RedisBytes suffix) {
        final byte[] current = value.getBytesUnsafe();
        final byte[] tail = suffix.getBytesUnsafe();
        final byte[] combined = Arrays.copyOf(current, current.length + tail.length);
        System.arraycopy(tail, 0, combined, current.length, tail.length);
        value = RedisBytes.wrapTrusted(combined);
        return combined.length;
    }

    /**
     * 按GETRANGE语义截取子串，start和end都包含在内，负数从末尾倒数。
     *
     * @param start 起始下标
     * @param end 结束下标
     * @return 子串，范围为空时返回空串
     */
    public synchronized RedisBytes getRange(long start, long end) {
        final int length = value.length();
        if (start < 0 && end < 0 && start > end) {
            return RedisBytes.EMPTY;
        }
        if (start < 0) {
            start = length + start;
        }
        if (end < 0) {
            end = length + end;
        }
        if (start < 0) {
            start = 0;
        }
        if (end < 0) {
            end = 0;
        }
        if (end >= length) {
            end = length - 1;
        }
        if (length == 0 || start > end) {
            return RedisBytes.EMPTY;
        }
        return RedisBytes.wrapTrusted(Arrays.copyOfRange(value.getBytesUnsafe(), (int) start, (int) end + 1));
    }

    /**
     * 把值解析为64位整数并加上增量
     *
     * @param delta 增量，可以为负数
     * @return 计算后的新值
     * @throws InvalidArgumentException 值不是整数或结果溢出
     */
    public synchronized long incrBy(final long delta) {
        final long current = parseLong(value);
        final long result;
        try {
            result = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("increment or decrement would overflow");
        }
        value = RedisBytes.fromLong(result);
        return result;
    }

    /**
     * 把值解析为十进制小数并加上增量，结果去掉多余的0后保存
     *
     * @param delta 增量
     * @return 新值的文本形式
     * @throws InvalidArgumentException 值不是合法的小数，或结果超出double范围
     */
    public synchronized RedisBytes incrByFloat(final BigDecimal delta) {
        final BigDecimal result = parseDecimal(value).add(delta);
        if (Double.isInfinite(result.doubleValue())) {
            throw new InvalidArgumentException("increment would produce NaN or Infinity");
        }
        value = RedisBytes.fromString(formatDecimal(result));
        return value;
    }

    /**
     * 解析十进制小数，不接受空白、inf和NaN
     *
     * @param bytes 待解析的内容
     * @return 解析结果
     * @throws InvalidArgumentException 无法解析时
     */
    public static BigDecimal parseDecimal(final RedisBytes bytes) {
        final String text = bytes.getString();
        if (text.isEmpty() || text.length() > MAX_DECIMAL_CHARS) {
            throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
        }
        try {
            final BigDecimal parsed = new BigDecimal(text);
            if (Double.isInfinite(parsed.doubleValue())) {
                throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
        }
    }

    private static String formatDecimal(final BigDecimal decimal) {
        if (decimal.signum() == 0 || decimal.doubleValue() == 0) {
            return "0";
        }
        return decimal.round(DECIMAL_PRECISION).stripTrailingZeros().toPlainString();
    }

    /**
     * 严格解析十进制整数：不允许前导'+'、空白或超过20个字符。
     *
     * @param bytes 待解析的内容
     * @return 解析结果
     * @throws InvalidArgumentException 无法解析时
     */
    public static long parseLong(final RedisBytes bytes) {
        final int length = bytes.length();
        if (length == 0 || length > MAX_LONG_CHARS || bytes.getBytesUnsafe()[0] == '+') {
            throw new InvalidArgumentException(InvalidArgumentException.NOT_AN_INTEGER);
        }
        try {
            return Long.parseLong(bytes.getString());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(InvalidArgumentException.NOT_AN_INTEGER);
        }
    }
}
