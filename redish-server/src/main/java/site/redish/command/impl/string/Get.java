package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisString;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * GET key，键不存在时返回null
 *
 * @author redish
 * @since 1.0.0
 */
public class Get extends AbstractCommand {

    public Get(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public Resp handle() {
        final RedisString value = db().getAs(arg(1), RedisString.class);
        return value == null ? BulkString.NULL : bulk(value.getValue());
    }
}
