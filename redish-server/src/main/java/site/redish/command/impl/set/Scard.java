package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisSet;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * SCARD key
 *
 * @author redish
 * @since 1.0.0
 */
public class Scard extends AbstractCommand {

    public Scard(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SCARD;
    }

    @Override
    public Resp handle() {
        final RedisSet set = db().getAs(arg(1), RedisSet.class);
        return set == null ? RespInteger.ZERO : RespInteger.valueOf(set.size());
    }
}
