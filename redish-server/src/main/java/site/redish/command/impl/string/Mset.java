package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MSET key value [key value ...]，所有键一次写入
 *
 * @author redish
 * @since 1.0.0
 */
public class Mset extends AbstractCommand {

    public Mset(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.MSET;
    }

    @Override
    protected void parseArguments() {
        if (argCount() % 2 == 0) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
    }

    @Override
    public Resp handle() {
        final Map<RedisBytes, RedisString> entries = new LinkedHashMap<>();
        for (int i = 1; i < argCount(); i += 2) {
            entries.put(arg(i), new RedisString(arg(i + 1)));
        }
        db().putAll(entries);
        return SimpleString.OK;
    }
}
