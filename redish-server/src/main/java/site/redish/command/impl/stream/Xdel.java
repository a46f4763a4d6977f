package site.redish.command.impl.stream;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisStream;
import site.redish.datastructure.StreamId;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;

/**
 * XDEL key id [id ...]，返回实际删除的条数。任何一个ID不合法时不删除。
 *
 * @author redish
 * @since 1.0.0
 */
public class Xdel extends AbstractCommand {

    private final List<StreamId> ids = new ArrayList<>();

    public Xdel(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.XDEL;
    }

    @Override
    protected void parseArguments() {
        for (int i = 2; i < argCount(); i++) {
            ids.add(StreamId.parse(arg(i), 0));
        }
    }

    @Override
    public Resp handle() {
        final Integer removed = db().update(arg(1), RedisStream.class, null, stream -> stream.delete(ids));
        return RespInteger.valueOf(removed == null ? 0 : removed);
    }
}
