package site.redish.command.impl.stream;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisStream;
import site.redish.datastructure.StreamId;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * XADD key id field value [field value ...]
 *
 * <p>id为"*"时按当前时间生成，返回实际使用的ID。ID不合法时键保持原样，不会创建空流。
 *
 * @author redish
 * @since 1.0.0
 */
public class Xadd extends AbstractCommand {

    public Xadd(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.XADD;
    }

    @Override
    protected void parseArguments() {
        if (argCount() % 2 == 0) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
    }

    @Override
    public Resp handle() {
        final RedisBytes requested = arg(2);
        final List<RedisBytes> fieldValues = argsFrom(3);
        final long now = db().getClock().millis();
        final StreamId id = db().update(arg(1), RedisStream.class, RedisStream::new,
                stream -> stream.add(requested, fieldValues, now));
        return bulk(id.toBytes());
    }
}
