package site.redish.datastructure;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.redish.exception.InvalidArgumentException;

/**
 * 流条目ID，形如"毫秒时间戳-序号"，先比较时间戳再比较序号。
 *
 * <p>两部分都是非负的64位整数。
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class StreamId implements Comparable<StreamId> {

    public static final StreamId MIN = new StreamId(0, 0);

    public static final StreamId MAX = new StreamId(Long.MAX_VALUE, Long.MAX_VALUE);

    public static final String INVALID_ID = "Invalid stream ID specified as stream command argument";

    private final long millis;

    private final long sequence;

    public StreamId(final long millis, final long sequence) {
        if (millis < 0 || sequence < 0) {
            throw new InvalidArgumentException(INVALID_ID);
        }
        this.millis = millis;
        this.sequence = sequence;
    }

    /**
     * 解析ID，省略序号时使用defaultSequence
     *
     * @param text "ms-seq"或"ms"
     * @param defaultSequence 省略序号时的取值
     * @return 解析结果
     * @throws InvalidArgumentException 格式不合法
     */
    public static StreamId parse(final RedisBytes text, final long defaultSequence) {
        final String value = text.getString();
        final int dash = value.indexOf('-');
        if (dash < 0) {
            return new StreamId(parsePart(value), defaultSequence);
        }
        return new StreamId(parsePart(value.substring(0, dash)), parsePart(value.substring(dash + 1)));
    }

    /**
     * 解析区间的起点，"-"表示最小ID
     */
    public static StreamId parseRangeStart(final RedisBytes text) {
        if ("-".equals(text.getString())) {
            return MIN;
        }
        return parse(text, 0);
    }

    /**
     * 解析区间的终点，"+"表示最大ID
     */
    public static StreamId parseRangeEnd(final RedisBytes text) {
        if ("+".equals(text.getString())) {
            return MAX;
        }
        return parse(text, Long.MAX_VALUE);
    }

    static long parsePart(final String part) {
        if (part.isEmpty() || part.charAt(0) == '+' || part.charAt(0) == '-') {
            throw new InvalidArgumentException(INVALID_ID);
        }
        try {
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(INVALID_ID);
        }
    }

    @Override
    public int compareTo(final StreamId other) {
        final int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
    }

    public RedisBytes toBytes() {
        return RedisBytes.fromString(toString());
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
