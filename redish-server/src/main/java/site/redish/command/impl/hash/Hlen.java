package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * HLEN key
 *
 * @author redish
 * @since 1.0.0
 */
public class Hlen extends AbstractCommand {

    public Hlen(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HLEN;
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().getAs(arg(1), RedisHash.class);
        return hash == null ? RespInteger.ZERO : RespInteger.valueOf(hash.fieldCount());
    }
}
