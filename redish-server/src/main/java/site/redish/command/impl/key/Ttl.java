package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * TTL key：-2键不存在，-1永不过期，否则为剩余秒数（四舍五入）
 *
 * @author redish
 * @since 1.0.0
 */
public class Ttl extends AbstractCommand {

    public Ttl(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.TTL;
    }

    @Override
    public Resp handle() {
        final long ttl = db().ttl(arg(1));
        if (ttl < 0) {
            return RespInteger.valueOf(ttl);
        }
        return RespInteger.valueOf((ttl + 500) / 1000);
    }
}
