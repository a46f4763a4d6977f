package site.redish.command.impl.string;

import site.redish.command.CommandType;
import site.redish.server.context.RedisContext;

/**
 * DECR key
 *
 * @author redish
 * @since 1.0.0
 */
public class Decr extends CounterCommand {

    public Decr(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.DECR;
    }

    @Override
    protected long delta() {
        return -1L;
    }
}
