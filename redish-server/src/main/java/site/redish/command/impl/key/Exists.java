package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * EXISTS key [key ...]，重复的键重复计数
 *
 * @author redish
 * @since 1.0.0
 */
public class Exists extends AbstractCommand {

    public Exists(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.EXISTS;
    }

    @Override
    public Resp handle() {
        long count = 0;
        for (final RedisBytes key : argsFrom(1)) {
            if (db().exists(key)) {
                count++;
            }
        }
        return RespInteger.valueOf(count);
    }
}
