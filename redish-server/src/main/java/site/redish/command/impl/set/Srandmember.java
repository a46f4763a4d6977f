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
 * SRANDMEMBER key [count]
 *
 * <p>不修改集合。count为正数时返回不重复的成员，为负数时返回|count|个可能重复的成员。
 *
 * @author redish
 * @since 1.0.0
 */
public class Srandmember extends AbstractCommand {

    private int count = 1;

    private boolean withCount;

    public Srandmember(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SRANDMEMBER;
    }

    @Override
    protected void parseArguments() {
        if (argCount() > 3) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
        if (argCount() == 3) {
            final long requested = longArg(2);
            if (requested < -Integer.MAX_VALUE) {
                throw new InvalidArgumentException("value is out of range");
            }
            count = (int) Math.min(requested, Integer.MAX_VALUE);
            withCount = true;
        }
    }

    @Override
    public Resp handle() {
        final RedisSet set = db().getAs(arg(1), RedisSet.class);
        final List<RedisBytes> picked = set == null ? null : set.randomMembers(count);
        if (withCount) {
            return picked == null ? RespArray.EMPTY : bulkArray(picked);
        }
        return picked == null || picked.isEmpty() ? BulkString.NULL : bulk(picked.get(0));
    }
}
