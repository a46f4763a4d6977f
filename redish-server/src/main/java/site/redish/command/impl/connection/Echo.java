package site.redish.command.impl.connection;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;

/**
 * ECHO message
 *
 * @author redish
 * @since 1.0.0
 */
public class Echo extends AbstractCommand {

    public Echo(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public Resp handle() {
        return bulk(arg(1));
    }
}
