package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * HGET key field
 *
 * @author redish
 * @since 1.0.0
 */
public class Hget extends AbstractCommand {

    public Hget(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().getAs(arg(1), RedisHash.class);
        return hash == null ? BulkString.NULL : bulk(hash.getField(arg(2)));
    }
}
