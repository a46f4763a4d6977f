package site.redish.command.impl.hash;

import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * HMSET key field value [field value ...]
 *
 * @author redish
 * @since 1.0.0
 */
public class Hmset extends Hset {

    public Hmset(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HMSET;
    }

    @Override
    public Resp handle() {
        setFields();
        return SimpleString.OK;
    }
}
