package site.redish.command.impl.connection;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.Resp;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;

/**
 * PING [message]
 *
 * @author redish
 * @since 1.0.0
 */
public class Ping extends AbstractCommand {

    public Ping(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    protected void parseArguments() {
        if (argCount() > 2) {
            throw new WrongNumberOfArgumentsException(getType().getCommandName());
        }
    }

    @Override
    public Resp handle() {
        if (argCount() == 2) {
            return bulk(arg(1));
        }
        return SimpleString.PONG;
    }
}
