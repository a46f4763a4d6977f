package site.redish.command.impl.server;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

import java.time.Instant;
import java.util.Arrays;

/**
 * TIME，返回[秒, 微秒]，时间取自数据库的时钟
 *
 * @author redish
 * @since 1.0.0
 */
public class Time extends AbstractCommand {

    public Time(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.TIME;
    }

    @Override
    public Resp handle() {
        final Instant now = db().getClock().instant();
        return bulkArray(Arrays.asList(
                RedisBytes.fromLong(now.getEpochSecond()),
                RedisBytes.fromLong(now.getNano() / 1000)));
    }
}
