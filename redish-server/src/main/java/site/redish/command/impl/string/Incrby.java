package site.redish.command.impl.string;

import site.redish.command.CommandType;
import site.redish.server.context.RedisContext;

/**
 * INCRBY key increment
 *
 * @author redish
 * @since 1.0.0
 */
public class Incrby extends CounterCommand {

    private long increment;

    public Incrby(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.INCRBY;
    }

    @Override
    protected void parseArguments() {
        increment = longArg(2);
    }

    @Override
    protected long delta() {
        return increment;
    }
}
