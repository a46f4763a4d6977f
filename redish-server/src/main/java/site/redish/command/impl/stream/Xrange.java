package site.redish.command.impl.stream;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisStream;
import site.redish.datastructure.StreamId;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.Locale;

/**
 * XRANGE key start end [COUNT count]
 *
 * <p>"-"和"+"表示最小和最大ID；只给出时间戳时，起点补序号0，终点补最大序号。
 *
 * @author redish
 * @since 1.0.0
 */
public class Xrange extends AbstractCommand {

    private StreamId start;

    private StreamId end;

    private long count = -1;

    public Xrange(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.XRANGE;
    }

    @Override
    protected void parseArguments() {
        start = StreamId.parseRangeStart(arg(2));
        end = StreamId.parseRangeEnd(arg(3));
        if (argCount() == 4) {
            return;
        }
        if (argCount() != 6 || !"COUNT".equals(arg(4).getString().toUpperCase(Locale.ROOT))) {
            throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
        }
        count = Math.max(0, longArg(5));
    }

    @Override
    public Resp handle() {
        final RedisStream stream = db().getAs(arg(1), RedisStream.class);
        if (stream == null) {
            return RespArray.EMPTY;
        }
        return StreamReplies.entries(stream.range(start, end, count));
    }
}
