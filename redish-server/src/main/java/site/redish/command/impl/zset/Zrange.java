package site.redish.command.impl.zset;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisZset;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;

/**
 * ZRANGE key start stop [WITHSCORES]
 *
 * @author redish
 * @since 1.0.0
 */
public class Zrange extends AbstractCommand {

    private static final RedisBytes WITHSCORES = RedisBytes.fromString("WITHSCORES");

    private long start;

    private long stop;

    private boolean withScores;

    public Zrange(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ZRANGE;
    }

    @Override
    protected void parseArguments() {
        if (argCount() > 5 || (argCount() == 5 && !arg(4).equalsIgnoreCase(WITHSCORES))) {
            throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
        }
        withScores = argCount() == 5;
        start = longArg(2);
        stop = longArg(3);
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().getAs(arg(1), RedisZset.class);
        if (zset == null) {
            return RespArray.EMPTY;
        }
        final List<RedisBytes> reply = new ArrayList<>();
        for (final RedisZset.ZsetEntry entry : zset.range(start, stop)) {
            reply.add(entry.getMember());
            if (withScores) {
                reply.add(formatDouble(entry.getScore()));
            }
        }
        return bulkArray(reply);
    }
}
