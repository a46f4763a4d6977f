package site.redish.command.impl.stream;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisStream;
import site.redish.exception.InvalidArgumentException;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.protocol.RespInteger;
import site.redish.server.context.RedisContext;

import java.util.Locale;

/**
 * XINFO STREAM key
 *
 * <p>回复为扁平的[名称, 值, ...]：length、last-generated-id、entries-added、
 * groups、first-entry、last-entry。不支持消费者组，groups总是0。
 *
 * @author redish
 * @since 1.0.0
 */
public class Xinfo extends AbstractCommand {

    public Xinfo(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.XINFO;
    }

    @Override
    protected void parseArguments() {
        final String subcommand = arg(1).getString().toUpperCase(Locale.ROOT);
        if (!"STREAM".equals(subcommand)) {
            throw new InvalidArgumentException("unknown subcommand '" + arg(1).getString()
                    + "'. Try XINFO HELP.");
        }
        if (argCount() != 3) {
            throw new WrongNumberOfArgumentsException("xinfo|stream");
        }
    }

    @Override
    public Resp handle() {
        final RedisStream stream = db().getAs(arg(2), RedisStream.class);
        if (stream == null) {
            throw new InvalidArgumentException("no such key");
        }
        return RespArray.valueOf(new Resp[]{
                BulkString.fromString("length"), RespInteger.valueOf(stream.length()),
                BulkString.fromString("last-generated-id"), BulkString.create(stream.getLastId().toBytes()),
                BulkString.fromString("entries-added"), RespInteger.valueOf(stream.getEntriesAdded()),
                BulkString.fromString("groups"), RespInteger.valueOf(0),
                BulkString.fromString("first-entry"), StreamReplies.entry(stream.firstEntry()),
                BulkString.fromString("last-entry"), StreamReplies.entry(stream.lastEntry())
        });
    }
}
