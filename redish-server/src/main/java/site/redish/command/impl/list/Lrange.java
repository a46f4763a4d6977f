package site.redish.command.impl.list;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisList;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

/**
 * LRANGE key start stop
 *
 * @author redish
 * @since 1.0.0
 */
public class Lrange extends AbstractCommand {

    private long start;

    private long stop;

    public Lrange(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.LRANGE;
    }

    @Override
    protected void parseArguments() {
        start = longArg(2);
        stop = longArg(3);
    }

    @Override
    public Resp handle() {
        final RedisList list = db().getAs(arg(1), RedisList.class);
        return list == null ? RespArray.EMPTY : bulkArray(list.range(start, stop));
    }
}
