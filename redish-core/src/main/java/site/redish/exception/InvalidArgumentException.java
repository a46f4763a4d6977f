package site.redish.exception;

/**
 * 参数值不合法，例如无法解析为整数、语法错误、字段名为null。
 *
 * @author redish
 * @since 1.0.0
 */
public class InvalidArgumentException extends RedisCommandException {

    /** 参数或存储的值不是64位整数 */
    public static final String NOT_AN_INTEGER = "value is not an integer or out of range";

    /** 参数不是合法的浮点数 */
    public static final String NOT_A_FLOAT = "value is not a valid float";

    /** 命令选项无法识别 */
    public static final String SYNTAX_ERROR = "syntax error";

    /**
     * @param detail 不带"ERR "前缀的错误描述
     */
    public InvalidArgumentException(final String detail) {
        super("ERR " + detail);
    }
}
