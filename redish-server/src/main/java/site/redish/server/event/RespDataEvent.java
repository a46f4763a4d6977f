package site.redish.server.event;

import lombok.Getter;
import site.redish.protocol.Resp;
import site.redish.protocol.RespType;

import java.util.UUID;

/**
 * 一个解码完成的顶层RESP元素
 *
 * <p>{@link #getType()}是元素的类型标签，null形式的批量字符串和数组为
 * {@link RespType#NULL}，消费者按标签分支处理。
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
public final class RespDataEvent {

    private final UUID sessionId;

    private final RespType type;

    private final Resp value;

    private final long timestamp;

    public RespDataEvent(final UUID sessionId, final Resp value) {
        this(sessionId, value, System.currentTimeMillis());
    }

    public RespDataEvent(final UUID sessionId, final Resp value, final long timestamp) {
        this.sessionId = sessionId;
        this.type = RespType.of(value);
        this.value = value;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "RespDataEvent{session=" + sessionId + ", type=" + type + ", value=" + value + '}';
    }
}
