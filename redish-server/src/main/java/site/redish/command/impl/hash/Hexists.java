package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * HEXISTS key field
 *
 * @author redish
 * @since 1.0.0
 */
public class Hexists extends AbstractCommand {

    public Hexists(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HEXISTS;
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().getAs(arg(1), RedisHash.class);
        return hash != null && hash.containsField(arg(2)) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
