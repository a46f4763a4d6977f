package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * DEL key [key ...]，返回实际删除的键数
 *
 * @author redish
 * @since 1.0.0
 */
public class Del extends AbstractCommand {

    public Del(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public Resp handle() {
        long deleted = 0;
        for (final RedisBytes key : argsFrom(1)) {
            if (db().delete(key)) {
                deleted++;
            }
        }
        return RespInteger.valueOf(deleted);
    }
}
