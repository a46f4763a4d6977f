package site.redish.server.config;

import lombok.Builder;
import lombok.Data;
import site.redish.protocol.Resp;

import java.util.UUID;

/**
 * Redis服务器配置类，统一管理所有服务器配置参数。
 *
 * <p>采用Builder模式创建，所有参数都有默认值。主要配置包括：
 * <ul>
 *   <li>网络配置：主机地址、端口、连接参数等
 *   <li>线程配置：各类线程池大小设置
 *   <li>数据库配置：数据库数量
 *   <li>复制配置：服务器标识、复制积压缓冲区大小
 *   <li>协议配置：单行最大长度
 * </ul>
 *
 * <p>服务器在构造时调用{@link #validate()}，非法配置不会打开任何socket。
 *
 * @author redish
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    /** 端口号上限 */
    public static final int MAX_PORT = 65535;

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>127.0.0.1仅本机访问，0.0.0.0允许所有网络访问。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /**
     * 服务器监听端口，0表示由操作系统分配临时端口。
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接） */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行器线程数。
     *
     * <p>每个连接固定绑定到其中一个线程，同一连接的命令按顺序执行，
     * 不同连接之间并行。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 数据库配置 ==========

    /** 数据库数量，索引为0..N-1 */
    @Builder.Default
    private int databaseCount = 16;

    // ========== 复制配置 ==========

    /**
     * 复制积压缓冲区大小（字节）。
     *
     * <p>目前只做校验并在INFO中报告，本服务器不实现复制。
     */
    @Builder.Default
    private long replicationBacklogSize = 1024 * 1024;

    /** 服务器标识，默认为去掉连字符的随机UUID */
    @Builder.Default
    private String serverId = UUID.randomUUID().toString().replace("-", "");

    // ========== 协议配置 ==========

    /** 未遇到行结束符时允许的最大行长度（字节） */
    @Builder.Default
    private int maxLineLength = Resp.DEFAULT_MAX_LINE_LENGTH;

    /**
     * 创建默认配置。
     *
     * @return 默认配置实例
     */
    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("host must not be blank");
        }

        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port must be in range 0-" + MAX_PORT + ": " + port);
        }

        if (databaseCount < 1) {
            throw new IllegalArgumentException("database count must be at least 1: " + databaseCount);
        }

        if (replicationBacklogSize < 0) {
            throw new IllegalArgumentException("replication backlog size must not be negative: "
                    + replicationBacklogSize);
        }

        if (serverId == null || serverId.trim().isEmpty()) {
            throw new IllegalArgumentException("server id must not be blank");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("thread counts must be positive");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0 || maxLineLength <= 0) {
            throw new IllegalArgumentException("backlog and buffer sizes must be positive");
        }
    }
}
