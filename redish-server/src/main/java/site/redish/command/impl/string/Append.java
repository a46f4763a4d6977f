package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * APPEND key value，返回追加后的长度
 *
 * @author redish
 * @since 1.0.0
 */
public class Append extends AbstractCommand {

    public Append(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.APPEND;
    }

    @Override
    public Resp handle() {
        final RedisBytes suffix = arg(2);
        final Integer length = db().update(arg(1), RedisString.class,
                () -> new RedisString(RedisBytes.EMPTY), value -> value.append(suffix));
        return RespInteger.valueOf(length);
    }
}
