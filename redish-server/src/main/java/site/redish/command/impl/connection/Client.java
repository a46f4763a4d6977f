package site.redish.command.impl.connection;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.exception.InvalidArgumentException;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespInteger;
import site.redish.protocol.SimpleString;
import site.redish.server.context.RedisContext;
import site.redish.server.session.ClientSession;

import java.util.Locale;

/**
 * CLIENT ID | SETNAME name | GETNAME | LIST
 *
 * @author redish
 * @since 1.0.0
 */
public class Client extends AbstractCommand {

    private String subcommand;

    public Client(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.CLIENT;
    }

    @Override
    protected void parseArguments() {
        subcommand = arg(1).getString().toUpperCase(Locale.ROOT);
        final int expected;
        switch (subcommand) {
            case "ID":
            case "GETNAME":
            case "LIST":
                expected = 2;
                break;
            case "SETNAME":
                expected = 3;
                break;
            default:
                throw new InvalidArgumentException("unknown subcommand '" + arg(1).getString()
                        + "'. Try CLIENT HELP.");
        }
        if (argCount() != expected) {
            throw new WrongNumberOfArgumentsException("client|" + subcommand);
        }
        if ("SETNAME".equals(subcommand)) {
            for (final byte b : arg(2).getBytesUnsafe()) {
                if (b < '!' || b > '~') {
                    throw new InvalidArgumentException(
                            "Client names cannot contain spaces, newlines or special characters.");
                }
            }
        }
    }

    @Override
    public Resp handle() {
        final ClientSession session = context.getSession();
        switch (subcommand) {
            case "ID":
                return RespInteger.valueOf(session.getClientId());
            case "SETNAME":
                final String name = arg(2).getString();
                session.setName(name.isEmpty() ? null : name);
                return SimpleString.OK;
            case "GETNAME":
                return session.getName() == null ? BulkString.NULL : BulkString.fromString(session.getName());
            default:
                return BulkString.create(RedisBytes.fromString(listClients()));
        }
    }

    private String listClients() {
        final long now = System.currentTimeMillis();
        final StringBuilder sb = new StringBuilder();
        for (final ClientSession client : context.getServer().getSessionManager().getSessions()) {
            sb.append("id=").append(client.getClientId())
                    .append(" addr=").append(client.getRemoteAddress())
                    .append(" name=").append(client.getName() == null ? "" : client.getName())
                    .append(" db=").append(client.getDbIndex())
                    .append(" age=").append((now - client.getCreatedAt()) / 1000)
                    .append('\n');
        }
        return sb.toString();
    }
}
