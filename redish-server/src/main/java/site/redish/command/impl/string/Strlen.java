package site.redish.command.impl.string;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * STRLEN key，返回值的字节长度
 *
 * @author redish
 * @since 1.0.0
 */
public class Strlen extends AbstractCommand {

    public Strlen(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.STRLEN;
    }

    @Override
    public Resp handle() {
        final RedisString value = db().getAs(arg(1), RedisString.class);
        return value == null ? RespInteger.ZERO : RespInteger.valueOf(value.length());
    }
}
