package site.redish.exception;

/**
 * 命令期望的值类型与键上存储的类型不一致。
 *
 * @author redish
 * @since 1.0.0
 */
public class WrongTypeException extends RedisCommandException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
