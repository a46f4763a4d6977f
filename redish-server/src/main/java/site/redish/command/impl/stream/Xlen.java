package site.redish.command.impl.stream;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisStream;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * XLEN key，键不存在时返回0
 *
 * @author redish
 * @since 1.0.0
 */
public class Xlen extends AbstractCommand {

    public Xlen(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.XLEN;
    }

    @Override
    public Resp handle() {
        final RedisStream stream = db().getAs(arg(1), RedisStream.class);
        return RespInteger.valueOf(stream == null ? 0 : stream.length());
    }
}
