package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * PERSIST key，移除键的过期时间
 *
 * @author redish
 * @since 1.0.0
 */
public class Persist extends AbstractCommand {

    public Persist(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.PERSIST;
    }

    @Override
    public Resp handle() {
        return db().persist(arg(1)) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
