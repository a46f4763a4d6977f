package site.redish.command.impl.list;

import site.redish.command.AbstractCommand;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisList;
import site.redish.exception.InvalidArgumentException;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * LPOP/RPOP key [count]
 *
 * <p>不带count时返回单个元素或null；带count时返回数组，键不存在返回null数组。
 *
 * @author redish
 * @since 1.0.0
 */
abstract class PopCommand extends AbstractCommand {

    private int count = 1;

    private boolean withCount;

    protected PopCommand(final RedisContext context) {
        super(context);
    }

    protected abstract List<RedisBytes> pop(RedisList list, int count);

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
        final List<RedisBytes> popped = db().update(arg(1), RedisList.class, null, list -> pop(list, count));
        if (withCount) {
            return popped == null ? RespArray.NULL : bulkArray(popped);
        }
        return popped == null || popped.isEmpty() ? BulkString.NULL : bulk(popped.get(0));
    }
}
