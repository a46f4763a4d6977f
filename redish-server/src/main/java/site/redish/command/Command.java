package site.redish.command;

import site.redish.protocol.Resp;

/**
 * Redis命令接口。
 *
 * <p>每次执行创建一个新实例：先{@link #setContext}解析参数，再{@link #handle}执行。
 * 参数个数已由分发器按{@link CommandType}的元数校验过；参数值的校验在
 * 访问数据库之前完成，失败时抛出{@link site.redish.exception.RedisCommandException}。
 *
 * @author redish
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 设置命令参数。
     *
     * @param array 完整的请求数组，第0个元素是命令名
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP协议格式的执行结果
     */
    Resp handle();

    /**
     * 判断是否为写命令。
     *
     * @return 如果是写命令返回true，读命令返回false
     */
    boolean isWriteCommand();
}
