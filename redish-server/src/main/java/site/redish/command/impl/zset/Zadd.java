package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisZset;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * ZADD key score member [score member ...]，返回新增成员的个数
 *
 * @author redish
 * @since 1.0.0
 */
public class Zadd extends AbstractCommand {

    private double[] scores;

    public Zadd(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZADD;
    }

    @Override
    protected void parseArguments() {
        if (argCount() % 2 != 0) {
            throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
        }
        scores = new double[(argCount() - 2) / 2];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = doubleArg(2 + i * 2);
        }
    }

    @Override
    public Resp handle() {
        final Integer added = db().update(arg(1), RedisZset.class, RedisZset::new, zset -> {
            int count = 0;
            for (int i = 0; i < scores.length; i++) {
                if (zset.add(scores[i], arg(3 + i * 2))) {
                    count++;
                }
            }
            return count;
        });
        return RespInteger.valueOf(added);
    }
}
