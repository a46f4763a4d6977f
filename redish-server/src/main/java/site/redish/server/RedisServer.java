package site.redish.server;

import site.redish.core.RedisCore;
import site.redish.server.config.RedisServerConfig;
import site.redish.server.event.RespEventPublisher;
import site.redish.server.session.SessionManager;

/**
 * Redis服务器核心接口，定义服务器的生命周期和它持有的状态。
 *
 * <p>所有运行时状态（数据库、会话注册表、事件发布器、服务器标识）都由服务器实例持有，
 * 同一进程中可以运行多个互不干扰的实例。
 *
 * @author redish
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 启动服务器并绑定端口，返回时已可以接受连接。
     *
     * @throws IllegalStateException 如果服务器已经在运行或绑定失败
     */
    void start();

    /**
     * 停止接受新连接，关闭所有客户端连接并释放线程资源。
     */
    void stop();

    RedisCore getRedisCore();

    RedisServerConfig getConfig();

    SessionManager getSessionManager();

    RespEventPublisher getEventPublisher();

    String getServerId();

    /**
     * 实际绑定的端口，配置端口为0时由操作系统分配。
     *
     * @return 绑定的端口，未启动时返回-1
     */
    int getBoundPort();

    /**
     * 服务器启动时间（毫秒）
     *
     * @return 启动时间，未启动时返回0
     */
    long getStartTime();
}
