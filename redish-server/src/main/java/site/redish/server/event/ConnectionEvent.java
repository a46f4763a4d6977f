package site.redish.server.event;

import lombok.Getter;

import java.net.SocketAddress;
import java.util.UUID;

/**
 * 连接建立或断开事件
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
public final class ConnectionEvent {

    /**
     * 事件种类
     */
    public enum Kind {
        CONNECTED,
        DISCONNECTED
    }

    private final UUID sessionId;

    private final Kind kind;

    private final SocketAddress remoteAddress;

    private final long timestamp;

    public ConnectionEvent(final UUID sessionId, final Kind kind, final SocketAddress remoteAddress) {
        this.sessionId = sessionId;
        this.kind = kind;
        this.remoteAddress = remoteAddress;
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return "ConnectionEvent{session=" + sessionId + ", kind=" + kind + ", remote=" + remoteAddress + '}';
    }
}
