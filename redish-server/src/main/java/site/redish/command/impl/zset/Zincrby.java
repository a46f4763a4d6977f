package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisZset;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * ZINCRBY key increment member，返回新的分数
 *
 * @author redish
 * @since 1.0.0
 */
public class Zincrby extends AbstractCommand {

    private double increment;

    public Zincrby(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZINCRBY;
    }

    @Override
    protected void parseArguments() {
        increment = doubleArg(2);
    }

    @Override
    public Resp handle() {
        final Double score = db().update(arg(1), RedisZset.class, RedisZset::new,
                zset -> zset.incrBy(increment, arg(3)));
        return bulk(formatDouble(score));
    }
}
