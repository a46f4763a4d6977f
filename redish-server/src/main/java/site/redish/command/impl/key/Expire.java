package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.database.RedisDB;
import site.redish.datastructure.RedisBytes;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * EXPIRE key seconds，非正数的秒数立即删除键
 *
 * @author redish
 * @since 1.0.0
 */
public class Expire extends AbstractCommand {

    private long seconds;

    public Expire(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.EXPIRE;
    }

    @Override
    protected void parseArguments() {
        seconds = longArg(2);
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        if (seconds <= 0) {
            return db.delete(key) ? RespInteger.ONE : RespInteger.ZERO;
        }
        final long expireAt;
        try {
            expireAt = Math.addExact(db.getClock().millis(), Math.multiplyExact(seconds, 1000L));
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("invalid expire time in 'expire' command");
        }
        return db.expire(key, expireAt) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
