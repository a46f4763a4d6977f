package site.redish.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Redis整数类型
 *
 * <p>64位有符号整数回复。-10到127之间的值使用缓存实例。
 *
 * <p>预定义常量：
 * <ul>
 *     <li>ZERO - 数值0</li>
 *     <li>ONE - 数值1</li>
 *     <li>MINUS_ONE - 数值-1</li>
 *     <li>MINUS_TWO - 数值-2</li>
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespInteger extends Resp {
    private static final int CACHE_LOW = -10;
    private static final int CACHE_HIGH = 127;

    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = CACHE[-CACHE_LOW];
    public static final RespInteger ONE = CACHE[1 - CACHE_LOW];
    public static final RespInteger MINUS_ONE = CACHE[-1 - CACHE_LOW];
    public static final RespInteger MINUS_TWO = CACHE[-2 - CACHE_LOW];

    /** 整数值 */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法：获取 RespInteger 实例
     *
     * @param value 整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeLongAsBytes(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toString(content);
    }
}
