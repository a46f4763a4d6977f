package site.redish.command.impl.string;

import site.redish.command.CommandType;
import site.redish.server.context.RedisContext;

/**
 * INCR key
 *
 * @author redish
 * @since 1.0.0
 */
public class Incr extends CounterCommand {

    public Incr(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.INCR;
    }

    @Override
    protected long delta() {
        return 1L;
    }
}
