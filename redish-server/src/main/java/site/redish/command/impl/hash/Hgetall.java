package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

/**
 * HGETALL key，返回[field, value, ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Hgetall extends AbstractCommand {

    public Hgetall(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HGETALL;
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().getAs(arg(1), RedisHash.class);
        return hash == null ? RespArray.EMPTY : bulkArray(hash.getAll());
    }
}
