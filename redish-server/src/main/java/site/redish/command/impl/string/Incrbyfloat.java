package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

import java.math.BigDecimal;

/**
 * INCRBYFLOAT key increment
 *
 * <p>不存在的键按0处理，返回新值的文本形式。
 *
 * @author redish
 * @since 1.0.0
 */
public class Incrbyfloat extends AbstractCommand {

    private BigDecimal increment;

    public Incrbyfloat(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.INCRBYFLOAT;
    }

    @Override
    protected void parseArguments() {
        increment = RedisString.parseDecimal(arg(2));
    }

    @Override
    public Resp handle() {
        final RedisBytes result = db().update(arg(1), RedisString.class,
                () -> new RedisString(RedisBytes.fromLong(0)), value -> value.incrByFloat(increment));
        return bulk(result);
    }
}
