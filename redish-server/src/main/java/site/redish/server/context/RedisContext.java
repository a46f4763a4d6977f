package site.redish.server.context;

import lombok.Getter;
import site.redish.core.RedisCore;
import site.redish.database.RedisDB;
import site.redish.server.RedisServer;
import site.redish.server.session.ClientSession;

/**
 * 一次命令执行的上下文：服务器和发起命令的会话
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
public class RedisContext {

    private final RedisServer server;

    private final ClientSession session;

    public RedisContext(final RedisServer server, final ClientSession session) {
        this.server = server;
        this.session = session;
    }

    public RedisCore getRedisCore() {
        return server.getRedisCore();
    }

    /**
     * 当前会话选中的数据库
     *
     * @return 数据库实例
     */
    public RedisDB getDB() {
        return server.getRedisCore().getDB(session.getDbIndex());
    }

    /**
     * 切换当前会话的数据库，只影响本连接
     *
     * @param index 数据库索引
     * @throws site.redish.exception.InvalidArgumentException 索引超出范围
     */
    public void selectDB(final int index) {
        server.getRedisCore().getDB(index);
        session.setDbIndex(index);
    }
}
