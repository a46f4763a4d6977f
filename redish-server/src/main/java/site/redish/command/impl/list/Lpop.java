package site.redish.command.impl.list;

import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisList;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * LPOP key [count]
 *
 * @author redish
 * @since 1.0.0
 */
public class Lpop extends PopCommand {

    public Lpop(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPOP;
    }

    @Override
    protected List<RedisBytes> pop(final RedisList list, final int count) {
        return list.lpop(count);
    }
}
