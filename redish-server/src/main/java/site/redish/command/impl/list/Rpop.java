package site.redish.command.impl.list;

import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisList;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * RPOP key [count]
 *
 * @author redish
 * @since 1.0.0
 */
public class Rpop extends PopCommand {

    public Rpop(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.RPOP;
    }

    @Override
    protected List<RedisBytes> pop(final RedisList list, final int count) {
        return list.rpop(count);
    }
}
