package site.redish.protocol;

/**
 * RESP元素的类型标签。
 *
 * <p>{@link #NULL}不是独立的线路类型，而是长度为-1的批量字符串或数组
 * 在事件层面的分类，使用{@link #of(Resp)}计算。
 *
 * @author redish
 * @since 1.0.0
 */
public enum RespType {
    /** 简单字符串 "+" */
    SIMPLE_STRING('+'),
    /** 错误消息 "-" */
    ERROR('-'),
    /** 64位整数 ":" */
    INTEGER(':'),
    /** 批量字符串 "$" */
    BULK_STRING('$'),
    /** 数组 "*" */
    ARRAY('*'),
    /** 空批量字符串或空数组（长度为-1） */
    NULL((char) 0);

    private final char prefix;

    RespType(final char prefix) {
        this.prefix = prefix;
    }

    /**
     * 线路上的类型前缀字节，NULL没有前缀。
     *
     * @return 前缀字符
     */
    public char getPrefix() {
        return prefix;
    }

    /**
     * 计算元素的类型标签，null形式的批量字符串和数组归为NULL。
     *
     * @param resp 解码后的元素
     * @return 类型标签
     */
    public static RespType of(final Resp resp) {
        return resp.isNull() ? NULL : resp.getType();
    }
}
