package site.redish.command.impl.server;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

/**
 * DBSIZE，返回当前数据库的键数
 *
 * @author redish
 * @since 1.0.0
 */
public class Dbsize extends AbstractCommand {

    public Dbsize(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.DBSIZE;
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(db().size());
    }
}
