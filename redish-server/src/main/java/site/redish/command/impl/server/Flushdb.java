package site.redish.command.impl.server;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * FLUSHDB [ASYNC | SYNC]，两种模式都同步清空
 *
 * @author redish
 * @since 1.0.0
 */
public class Flushdb extends AbstractCommand {

    public Flushdb(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.FLUSHDB;
    }

    @Override
    protected void parseArguments() {
        Flushall.checkFlushMode(args.length, args.length > 1 ? arg(1) : null);
    }

    @Override
    public Resp handle() {
        db().clear();
        return SimpleString.OK;
    }
}
