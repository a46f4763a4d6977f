package site.redish.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redish.command.CommandDispatcher;
import site.redish.core.RedisCore;
import site.redish.core.RedisCoreImpl;
import site.redish.protocol.handler.RespDecoder;
import site.redish.protocol.handler.RespEncoder;
import site.redish.server.config.RedisServerConfig;
import site.redish.server.event.RespEventPublisher;
import site.redish.server.handler.ClientSessionHandler;
import site.redish.server.handler.RespCommandHandler;
import site.redish.server.session.SessionManager;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * 基于Netty的Redis服务器实现。
 *
 * <p>通道流水线：
 * <pre>
 * RespDecoder -> RespEncoder -> ClientSessionHandler -> [命令执行线程组] RespCommandHandler
 * </pre>
 * 解码和会话事件在I/O线程上执行，命令在{@link DefaultEventExecutorGroup}上执行，
 * 每个通道固定绑定一个执行线程，回复顺序与请求顺序一致，不同连接之间并行。
 *
 * <p>根据操作系统选择Epoll、KQueue或NIO。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedishServer implements RedisServer {

    /** Redis服务器配置 */
    private final RedisServerConfig config;

    /** 所有逻辑数据库 */
    private final RedisCore redisCore;

    /** 活跃会话注册表 */
    private final SessionManager sessionManager;

    /** RESP事件发布器 */
    private final RespEventPublisher eventPublisher;

    /** 命令分发器 */
    private final CommandDispatcher dispatcher;

    /** 服务器标识 */
    private final String serverId;

    /** 服务器Channel类型 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private volatile Channel serverChannel;

    private volatile long startTime;

    public RedishServer(final RedisServerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 构造时校验配置并创建数据库，不打开socket。
     *
     * @param config Redis服务器配置
     * @param clock 过期判断使用的时钟
     * @throws IllegalArgumentException 配置非法
     */
    public RedishServer(final RedisServerConfig config, final Clock clock) {
        config.validate();
        this.config = config;
        this.serverId = config.getServerId();
        this.redisCore = new RedisCoreImpl(config.getDatabaseCount(), clock);
        this.sessionManager = new SessionManager();
        this.eventPublisher = new RespEventPublisher();
        this.dispatcher = new CommandDispatcher(this);
    }

    @Override
    public synchronized void start() {
        if (serverChannel != null) {
            throw new IllegalStateException("server already started");
        }
        initializeEventLoopGroups();
        initializeCommandExecutor();

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder(config.getMaxLineLength()));
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(new ClientSessionHandler(sessionManager, eventPublisher));
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            startTime = System.currentTimeMillis();
            log.info("Redish server {} started at {}:{}", serverId, config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new IllegalStateException("interrupted while binding " + config.getHost() + ":" + config.getPort(), e);
        } catch (Exception e) {
            shutdownGroups();
            throw new IllegalStateException("failed to bind " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    @Override
    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close().sync();
            sessionManager.closeAll();
        } catch (InterruptedException e) {
            log.error("Redish server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            serverChannel = null;
            shutdownGroups();
            log.info("Redish server {} stopped", serverId);
        }
    }

    @Override
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (commandExecutor != null) {
            commandExecutor.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        log.info("CommandExecutor线程数: {}", config.getCommandExecutorThreadCount());
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("redish-cmd")
        );
    }
}
