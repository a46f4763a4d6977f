package site.redish.server.session;

import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 活跃会话注册表，由服务器实例持有
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class SessionManager {

    private final Map<UUID, ClientSession> sessions = new ConcurrentHashMap<>();

    private final AtomicLong nextClientId = new AtomicLong(1);

    /**
     * 为新通道创建会话并登记，初始状态为CONNECTING
     *
     * @param channel 客户端通道
     * @return 新会话
     */
    public ClientSession create(final Channel channel) {
        final ClientSession session = new ClientSession(UUID.randomUUID(), nextClientId.getAndIncrement(), channel);
        sessions.put(session.getId(), session);
        return session;
    }

    public void remove(final ClientSession session) {
        sessions.remove(session.getId());
    }

    public ClientSession get(final UUID id) {
        return sessions.get(id);
    }

    /**
     * 所有活跃会话的快照
     *
     * @return 会话列表
     */
    public Collection<ClientSession> getSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 服务器关闭时关闭所有连接
     */
    public void closeAll() {
        final Collection<ClientSession> snapshot = getSessions();
        for (final ClientSession session : snapshot) {
            session.transitionTo(SessionState.CLOSING);
            if (session.getChannel() != null) {
                session.getChannel().close();
            }
        }
        log.info("已关闭 {} 个客户端连接", snapshot.size());
    }
}
