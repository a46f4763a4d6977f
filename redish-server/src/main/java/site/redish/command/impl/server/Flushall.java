package site.redish.command.impl.server;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * FLUSHALL [ASYNC | SYNC]
 *
 * @author redish
 * @since 1.0.0
 */
public class Flushall extends AbstractCommand {

    private static final RedisBytes ASYNC = RedisBytes.fromString("ASYNC");

    private static final RedisBytes SYNC = RedisBytes.fromString("SYNC");

    public Flushall(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.FLUSHALL;
    }

    @Override
    protected void parseArguments() {
        checkFlushMode(args.length, args.length > 1 ? arg(1) : null);
    }

    @Override
    public Resp handle() {
        context.getRedisCore().flushAll();
        return SimpleString.OK;
    }

    static void checkFlushMode(final int argCount, final RedisBytes mode) {
        if (argCount > 2 || (mode != null && !mode.equalsIgnoreCase(ASYNC) && !mode.equalsIgnoreCase(SYNC))) {
            throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
        }
    }
}
