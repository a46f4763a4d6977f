package site.redish.command.impl.string;

import site.redish.command.CommandType;
import site.redish.exception.InvalidArgumentException;
import site.redish.server.context.RedisContext;

/**
 * DECRBY key decrement
 *
 * @author redish
 * @since 1.0.0
 */
public class Decrby extends CounterCommand {

    private long decrement;

    public Decrby(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.DECRBY;
    }

    @Override
    protected void parseArguments() {
        decrement = longArg(2);
        if (decrement == Long.MIN_VALUE) {
            throw new InvalidArgumentException("decrement would overflow");
        }
    }

    @Override
    protected long delta() {
        return -decrement;
    }
}
