package site.redish.server.event;

import lombok.extern.slf4j.Slf4j;

/**
 * 把RESP事件写入日志，连接事件为INFO，数据事件为DEBUG
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class LoggingRespListener implements RespListener {

    @Override
    public void onConnected(final ConnectionEvent event) {
        log.info("客户端连接: session={}, remote={}", event.getSessionId(), event.getRemoteAddress());
    }

    @Override
    public void onDisconnected(final ConnectionEvent event) {
        log.info("客户端断开: session={}, remote={}", event.getSessionId(), event.getRemoteAddress());
    }

    @Override
    public void onDataReceived(final RespDataEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("收到数据: session={}, type={}, value={}",
                    event.getSessionId(), event.getType(), event.getValue());
        }
    }
}
