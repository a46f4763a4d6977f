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
 * LPUSH key element [element ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Lpush extends AbstractCommand {

    public Lpush(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPUSH;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> values = argsFrom(2);
        final Integer length = db().update(arg(1), RedisList.class, RedisList::new, list -> list.lpush(values));
        return RespInteger.valueOf(length);
    }
}
