package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * HDEL key field [field ...]，删空后键被移除
 *
 * @author redish
 * @since 1.0.0
 */
public class Hdel extends AbstractCommand {

    public Hdel(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HDEL;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> fields = argsFrom(2);
        final Integer removed = db().update(arg(1), RedisHash.class, null, hash -> hash.removeFields(fields));
        return removed == null ? RespInteger.ZERO : RespInteger.valueOf(removed);
    }
}
