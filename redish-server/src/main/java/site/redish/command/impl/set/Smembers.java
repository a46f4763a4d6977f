package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisSet;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

/**
 * SMEMBERS key
 *
 * @author redish
 * @since 1.0.0
 */
public class Smembers extends AbstractCommand {

    public Smembers(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SMEMBERS;
    }

    @Override
    public Resp handle() {
        final RedisSet set = db().getAs(arg(1), RedisSet.class);
        return set == null ? RespArray.EMPTY : bulkArray(set.members());
    }
}
