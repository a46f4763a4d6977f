package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisZset;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * ZSCORE key member
 *
 * @author redish
 * @since 1.0.0
 */
public class Zscore extends AbstractCommand {

    public Zscore(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZSCORE;
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().getAs(arg(1), RedisZset.class);
        final Double score = zset == null ? null : zset.score(arg(2));
        return score == null ? BulkString.NULL : bulk(formatDouble(score));
    }
}
