package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisSet;
import site.redish.exception.InvalidArgumentException;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * SPOP key [count]
 *
 * <p>不带count时返回单个成员或null；带count时返回数组，键不存在返回空数组。
 *
 * @author redish
 * @since 1.0.0
 */
public class Spop extends AbstractCommand {

    private int count = 1;

    private boolean withCount;

    public Spop(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SPOP;
    }

    @Override
    protected void parseArguments() {
        if (argCount() > 3) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
        if (argCount() == 3) {
            final long requested = longArg(2);
            if (requested < 0) {
                throw new InvalidArgumentException("value is out of range, must be positive");
            }
            count = (int) Math.min(requested, Integer.MAX_VALUE);
            withCount = true;
        }
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> popped = db().update(arg(1), RedisSet.class, null, set -> set.pop(count));
        if (withCount) {
            return popped == null ? RespArray.EMPTY : bulkArray(popped);
        }
        return popped == null || popped.isEmpty() ? BulkString.NULL : bulk(popped.get(0));
    }
}
