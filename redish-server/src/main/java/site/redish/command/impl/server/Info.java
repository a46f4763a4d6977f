package site.redish.command.impl.server;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.database.RedisDB;
import site.redish.datastructure.RedisBytes;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.server.RedisServer;
import site.redish.server.context.RedisContext;

import java.util.Locale;

/**
 * INFO [section]：server、clients、replication、keyspace四个段
 *
 * @author redish
 * @since 1.0.0
 */
public class Info extends AbstractCommand {

    /** 服务器版本 */
    public static final String VERSION = "1.0.0";

    private String section;

    public Info(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.INFO;
    }

    @Override
    protected void parseArguments() {
        section = argCount() >= 2 ? arg(1).getString().toLowerCase(Locale.ROOT) : "default";
    }

    @Override
    public Resp handle() {
        final RedisServer server = context.getServer();
        final StringBuilder info = new StringBuilder();

        if (includes("server")) {
            info.append("# Server\r\n");
            info.append("redish_version:").append(VERSION).append("\r\n");
            info.append("server_id:").append(server.getServerId()).append("\r\n");
            info.append("os:").append(System.getProperty("os.name")).append("\r\n");
            info.append("java_version:").append(System.getProperty("java.version")).append("\r\n");
            info.append("tcp_port:").append(server.getBoundPort()).append("\r\n");
            final long uptime = server.getStartTime() > 0
                    ? (System.currentTimeMillis() - server.getStartTime()) / 1000 : 0;
            info.append("uptime_in_seconds:").append(uptime).append("\r\n");
            info.append("\r\n");
        }

        if (includes("clients")) {
            info.append("# Clients\r\n");
            info.append("connected_clients:").append(server.getSessionManager().size()).append("\r\n");
            info.append("\r\n");
        }

        if (includes("replication")) {
            info.append("# Replication\r\n");
            info.append("role:master\r\n");
            info.append("connected_slaves:0\r\n");
            info.append("repl_backlog_size:").append(server.getConfig().getReplicationBacklogSize()).append("\r\n");
            info.append("\r\n");
        }

        if (includes("keyspace")) {
            info.append("# Keyspace\r\n");
            for (final RedisDB db : server.getRedisCore().getDataBases()) {
                final long keys = db.size();
                if (keys > 0) {
                    info.append("db").append(db.getId()).append(":keys=").append(keys).append("\r\n");
                }
            }
        }

        return BulkString.create(RedisBytes.fromString(info.toString()));
    }

    private boolean includes(final String name) {
        return "default".equals(section) || "all".equals(section) || "everything".equals(section)
                || name.equals(section);
    }
}
