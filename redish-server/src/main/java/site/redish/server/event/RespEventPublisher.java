package site.redish.server.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 把事件按注册顺序分发给所有监听器
 *
 * <p>单个监听器抛出的异常只记录日志，不影响其他监听器和连接本身。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class RespEventPublisher {

    private final List<RespListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(final RespListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final RespListener listener) {
        listeners.remove(listener);
    }

    public void publishConnected(final ConnectionEvent event) {
        for (final RespListener listener : listeners) {
            try {
                listener.onConnected(event);
            } catch (RuntimeException e) {
                log.error("监听器 {} 处理连接事件失败: {}", listener, event, e);
            }
        }
    }

    public void publishDisconnected(final ConnectionEvent event) {
        for (final RespListener listener : listeners) {
            try {
                listener.onDisconnected(event);
            } catch (RuntimeException e) {
                log.error("监听器 {} 处理断开事件失败: {}", listener, event, e);
            }
        }
    }

    public void publishData(final RespDataEvent event) {
        for (final RespListener listener : listeners) {
            try {
                listener.onDataReceived(event);
            } catch (RuntimeException e) {
                log.error("监听器 {} 处理数据事件失败: {}", listener, event, e);
            }
        }
    }
}
