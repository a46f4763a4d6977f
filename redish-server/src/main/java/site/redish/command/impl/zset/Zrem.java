package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisZset;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * ZREM key member [member ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Zrem extends AbstractCommand {

    public Zrem(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZREM;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> members = argsFrom(2);
        final Integer removed = db().update(arg(1), RedisZset.class, null, zset -> zset.remove(members));
        return removed == null ? RespInteger.ZERO : RespInteger.valueOf(removed);
    }
}
