package site.redish.server.event;

/**
 * RESP事件监听器
 *
 * <p>每个解码出的顶层元素触发一次{@link #onDataReceived}，连接建立和断开
 * 分别触发{@link #onConnected}和{@link #onDisconnected}。事件都带有会话ID，
 * 可以区分多个客户端的数据流。同一连接的事件按到达顺序回调。
 *
 * <p>回调在连接的I/O线程上执行，实现不应阻塞。
 *
 * @author redish
 * @since 1.0.0
 */
public interface RespListener {

    default void onConnected(final ConnectionEvent event) {
    }

    default void onDisconnected(final ConnectionEvent event) {
    }

    void onDataReceived(RespDataEvent event);
}
