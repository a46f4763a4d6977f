package site.redish.exception;

import java.util.Locale;

/**
 * 命令参数个数不符合命令的元数定义。
 *
 * @author redish
 * @since 1.0.0
 */
public class WrongNumberOfArgumentsException extends RedisCommandException {

    public WrongNumberOfArgumentsException(final String commandName) {
        super("ERR wrong number of arguments for '" + commandName.toLowerCase(Locale.ROOT) + "' command");
    }
}
