package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisZset;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * ZCARD key
 *
 * @author redish
 * @since 1.0.0
 */
public class Zcard extends AbstractCommand {

    public Zcard(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZCARD;
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().getAs(arg(1), RedisZset.class);
        return zset == null ? RespInteger.ZERO : RespInteger.valueOf(zset.size());
    }
}
