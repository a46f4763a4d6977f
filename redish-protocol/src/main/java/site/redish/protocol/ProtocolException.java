package site.redish.protocol;

/**
 * 线路上出现不符合RESP语法的字节时抛出。
 *
 * <p>协议错误之后无法再确定下一个帧的起始位置，因此总是导致连接关闭。
 *
 * @author redish
 * @since 1.0.0
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(final String message) {
        super(message);
    }
}
