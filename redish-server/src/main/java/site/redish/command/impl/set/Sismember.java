package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisSet;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * SISMEMBER key member
 *
 * @author redish
 * @since 1.0.0
 */
public class Sismember extends AbstractCommand {

    public Sismember(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SISMEMBER;
    }

    @Override
    public Resp handle() {
        final RedisSet set = db().getAs(arg(1), RedisSet.class);
        return set != null && set.contains(arg(2)) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
