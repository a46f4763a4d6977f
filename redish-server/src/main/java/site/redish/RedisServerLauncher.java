package site.redish;

import lombok.extern.slf4j.Slf4j;
import site.redish.server.RedisServer;
import site.redish.server.RedishServer;
import site.redish.server.config.RedisServerConfig;
import site.redish.server.event.LoggingRespListener;

/**
 * 命令行启动入口
 *
 * <p>支持的参数：{@code --host}、{@code --port}、{@code --databases}、
 * {@code --repl-backlog-size}、{@code --server-id}。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class RedisServerLauncher {

    public static void main(final String[] args) {
        final RedisServerConfig config;
        try {
            config = parseArguments(args);
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("启动参数错误: {}", e.getMessage());
            System.exit(1);
            return;
        }

        final RedisServer redisServer = new RedishServer(config);
        redisServer.getEventPublisher().addListener(new LoggingRespListener());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "redish-shutdown"));

        redisServer.start();
    }

    /**
     * 把命令行参数解析为配置，未指定的参数使用默认值
     *
     * @param args 命令行参数
     * @return 配置
     * @throws IllegalArgumentException 参数无法识别或取值非法
     */
    static RedisServerConfig parseArguments(final String[] args) {
        final RedisServerConfig.RedisServerConfigBuilder builder = RedisServerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            final String option = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + option);
            }
            final String value = args[++i];
            switch (option) {
                case "--host":
                    builder.host(value);
                    break;
                case "--port":
                    builder.port(parseInt(option, value));
                    break;
                case "--databases":
                    builder.databaseCount(parseInt(option, value));
                    break;
                case "--repl-backlog-size":
                    builder.replicationBacklogSize(parseLong(option, value));
                    break;
                case "--server-id":
                    builder.serverId(value);
                    break;
                default:
                    throw new IllegalArgumentException("unknown option " + option);
            }
        }
        return builder.build();
    }

    private static int parseInt(final String option, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + option + ": " + value, e);
        }
    }

    private static long parseLong(final String option, final String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + option + ": " + value, e);
        }
    }
}
