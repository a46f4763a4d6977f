package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * GETRANGE key start end
 *
 * @author redish
 * @since 1.0.0
 */
public class Getrange extends AbstractCommand {

    private long start;

    private long end;

    public Getrange(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.GETRANGE;
    }

    @Override
    protected void parseArguments() {
        start = longArg(2);
        end = longArg(3);
    }

    @Override
    public Resp handle() {
        final RedisString value = db().getAs(arg(1), RedisString.class);
        return bulk(value == null ? RedisBytes.EMPTY : value.getRange(start, end));
    }
}
