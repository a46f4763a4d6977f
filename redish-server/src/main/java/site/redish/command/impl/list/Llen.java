package site.redish.command.impl.list;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisList;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * LLEN key
 *
 * @author redish
 * @since 1.0.0
 */
public class Llen extends AbstractCommand {

    public Llen(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.LLEN;
    }

    @Override
    public Resp handle() {
        final RedisList list = db().getAs(arg(1), RedisList.class);
        return list == null ? RespInteger.ZERO : RespInteger.valueOf(list.size());
    }
}
