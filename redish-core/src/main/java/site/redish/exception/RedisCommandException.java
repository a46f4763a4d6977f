package site.redish.exception;

/**
 * 命令级错误的基类。
 *
 * <p>异常消息就是返回给客户端的RESP错误文本（包含"ERR"、"WRONGTYPE"等前缀），
 * 分发器捕获后编码为错误回复，连接保持打开。
 *
 * @author redish
 * @since 1.0.0
 */
public abstract class RedisCommandException extends RuntimeException {

    protected RedisCommandException(final String errorMessage) {
        super(errorMessage);
    }
}
