package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * INCR、INCRBY、DECR、DECRBY的公共实现
 *
 * <p>不存在的键按0处理；值不是整数或结果溢出时报错，原值不变。
 *
 * @author redish
 * @since 1.0.0
 */
abstract class CounterCommand extends AbstractCommand {

    protected CounterCommand(final RedisContext context) {
        super(context);
    }

    /**
     * @return 本次的增量
     */
    protected abstract long delta();

    @Override
    public Resp handle() {
        final long delta = delta();
        final Long result = db().update(arg(1), RedisString.class,
                () -> new RedisString(RedisBytes.fromLong(0)), value -> value.incrBy(delta));
        return RespInteger.valueOf(result);
    }
}
