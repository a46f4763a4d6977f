package site.redish.command.impl.set;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisSet;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.List;

/**
 * SADD key member [member ...]，返回新增成员数
 *
 * @author redish
 * @since 1.0.0
 */
public class Sadd extends AbstractCommand {

    public Sadd(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SADD;
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> members = argsFrom(2);
        final Integer added = db().update(arg(1), RedisSet.class, RedisSet::new, set -> set.add(members));
        return RespInteger.valueOf(added);
    }
}
