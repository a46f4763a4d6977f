package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * SET key value：整体替换，原有的类型和过期时间一并丢弃
 *
 * @author redish
 * @since 1.0.0
 */
public class Set extends AbstractCommand {

    public Set(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public Resp handle() {
        db().put(arg(1), new RedisString(arg(2)));
        return SimpleString.OK;
    }
}
