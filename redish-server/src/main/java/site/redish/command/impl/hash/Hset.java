package site.redish.command.impl.hash;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisHash;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * HSET key field value [field value ...]，返回新增字段的个数
 *
 * @author redish
 * @since 1.0.0
 */
public class Hset extends AbstractCommand {

    public Hset(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    protected void parseArguments() {
        if (argCount() % 2 != 0) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(setFields());
    }

    /**
     * 在键的临界区内写入所有字段
     *
     * @return 新增字段的个数
     */
    protected int setFields() {
        final List<RedisBytes> fieldValues = argsFrom(2);
        return db().update(arg(1), RedisHash.class, RedisHash::new, hash -> hash.setFields(fieldValues));
    }
}
