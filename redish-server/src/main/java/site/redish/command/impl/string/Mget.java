package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisData;
import site.redish.datastructure.RedisString;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * MGET key [key ...]，不存在或不是字符串的键返回null
 *
 * @author redish
 * @since 1.0.0
 */
public class Mget extends AbstractCommand {

    public Mget(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.MGET;
    }

    @Override
    public Resp handle() {
        final List<RedisData> found = db().getAll(argsFrom(1));
        final Resp[] values = new Resp[found.size()];
        for (int i = 0; i < values.length; i++) {
            final RedisData data = found.get(i);
            values[i] = data instanceof RedisString ? bulk(((RedisString) data).getValue()) : BulkString.NULL;
        }
        return RespArray.valueOf(values);
    }
}
