package site.redish.server.session;

import io.netty.channel.Channel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 客户端连接会话
 *
 * <p>保存一个连接的身份和状态：会话ID、CLIENT ID使用的数字ID、
 * 当前选中的数据库、客户端名称以及生命周期状态。
 * 选中的数据库只属于本连接，SELECT不会影响其他连接。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
@Getter
public class ClientSession {

    private final UUID id;

    private final long clientId;

    private final Channel channel;

    private final long createdAt;

    private volatile int dbIndex;

    private volatile String name;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);

    public ClientSession(final UUID id, final long clientId, final Channel channel) {
        this.id = id;
        this.clientId = clientId;
        this.channel = channel;
        this.createdAt = System.currentTimeMillis();
    }

    public SessionState getState() {
        return state.get();
    }

    /**
     * 迁移会话状态，非法迁移被忽略
     *
     * @param next 目标状态
     * @return 迁移成功返回true
     */
    public boolean transitionTo(final SessionState next) {
        while (true) {
            final SessionState current = state.get();
            if (!current.canTransitionTo(next)) {
                log.debug("会话 {} 忽略非法状态迁移: {} -> {}", id, current, next);
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.debug("会话 {} 状态迁移: {} -> {}", id, current, next);
                return true;
            }
        }
    }

    public void setDbIndex(final int dbIndex) {
        this.dbIndex = dbIndex;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public SocketAddress getRemoteAddress() {
        return channel == null ? null : channel.remoteAddress();
    }

    @Override
    public String toString() {
        return "ClientSession{id=" + id + ", clientId=" + clientId + ", db=" + dbIndex
                + ", state=" + state.get() + ", remote=" + getRemoteAddress() + '}';
    }
}
