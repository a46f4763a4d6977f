package site.redish.command.impl.connection;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.core.RedisCoreImpl;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * SELECT index：切换当前连接的数据库
 *
 * @author redish
 * @since 1.0.0
 */
public class Select extends AbstractCommand {

    private int dbIndex;

    public Select(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SELECT;
    }

    @Override
    protected void parseArguments() {
        final long index = longArg(1);
        if (index < 0 || index > Integer.MAX_VALUE) {
            throw new InvalidArgumentException(RedisCoreImpl.DB_INDEX_OUT_OF_RANGE);
        }
        dbIndex = (int) index;
    }

    @Override
    public Resp handle() {
        context.selectDB(dbIndex);
        return SimpleString.OK;
    }
}
