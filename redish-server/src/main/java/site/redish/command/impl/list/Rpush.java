package site.redish.command.impl.list;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisList;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * RPUSH key element [element ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Rpush extends AbstractCommand {

    public Rpush(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.RPUSH;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> values = argsFrom(2);
        final Integer length = db().update(arg(1), RedisList.class, RedisList::new, list -> list.rpush(values));
        return RespInteger.valueOf(length);
    }
}
