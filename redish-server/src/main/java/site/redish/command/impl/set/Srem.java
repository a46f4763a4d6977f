package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisSet;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * SREM key member [member ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Srem extends AbstractCommand {

    public Srem(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SREM;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> members = argsFrom(2);
        final Integer removed = db().update(arg(1), RedisSet.class, null, set -> set.remove(members));
        return removed == null ? RespInteger.ZERO : RespInteger.valueOf(removed);
    }
}
