package site.redish.server.session;

/**
 * 连接会话状态
 *
 * <p>{@code CONNECTING -> ESTABLISHED -> (CLOSING | FAULTED) -> CLOSED}
 *
 * @author redish
 * @since 1.0.0
 */
public enum SessionState {

    /** 通道已注册，尚未完成接入 */
    CONNECTING,

    /** 已分配会话ID，可以收发命令 */
    ESTABLISHED,

    /** 正常关闭中 */
    CLOSING,

    /** 协议错误或I/O错误 */
    FAULTED,

    /** 已关闭，终态 */
    CLOSED;

    /**
     * 判断是否允许迁移到目标状态
     *
     * @param next 目标状态
     * @return 允许时返回true
     */
    public boolean canTransitionTo(final SessionState next) {
        switch (this) {
            case CONNECTING:
                return next == ESTABLISHED || next == CLOSING || next == FAULTED;
            case ESTABLISHED:
                return next == CLOSING || next == FAULTED;
            case CLOSING:
            case FAULTED:
                return next == CLOSED;
            default:
                return false;
        }
    }
}
