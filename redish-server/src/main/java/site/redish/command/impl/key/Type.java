package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisData;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * TYPE key，返回值的类型名，键不存在时返回none
 *
 * @author redish
 * @since 1.0.0
 */
public class Type extends AbstractCommand {

    private static final SimpleString NONE = new SimpleString("none");

    public Type(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.TYPE;
    }

    @Override
    public Resp handle() {
        final RedisData data = db().get(arg(1));
        if (data == null) {
            return NONE;
        }
        return SimpleString.valueOf(data.getType().getTypeName());
    }
}
