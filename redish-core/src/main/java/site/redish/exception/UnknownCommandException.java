package site.redish.exception;

/**
 * 命令名无法识别。
 *
 * @author redish
 * @since 1.0.0
 */
public class UnknownCommandException extends RedisCommandException {

    public UnknownCommandException(final String commandName) {
        super("ERR unknown command '" + commandName + "'");
    }
}
