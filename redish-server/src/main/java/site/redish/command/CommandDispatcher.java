package site.redish.command;

import lombok.extern.slf4j.Slf4j;
import site.redish.datastructure.RedisBytes;
import site.redish.exception.RedisCommandException;
import site.redish.exception.UnknownCommandException;
import site.redish.exception.WrongNumberOfArgumentsException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Errors;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.RedisServer;
import site.redish.server.context.RedisContext;
import site.redish.server.session.ClientSession;

/**
 * 命令分发器，把一个请求数组路由到对应的命令并返回回复。
 *
 * <p>请求必须是非空的批量字符串数组，第一个元素是命令名。
 * 所有命令级错误都编码为RESP错误回复返回，连接保持打开。
 *
 * @author redish
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    /** 请求不是批量字符串数组 */
    public static final Errors MALFORMED_REQUEST = new Errors("ERR Protocol error: expected array of bulk strings");

    private final RedisServer server;

    public CommandDispatcher(final RedisServer server) {
        this.server = server;
    }

    /**
     * 执行一个请求
     *
     * @param session 发起请求的会话
     * @param request 解码后的请求
     * @return 回复，不为null
     */
    public Resp dispatch(final ClientSession session, final Resp request) {
        final Resp[] array = toArguments(request);
        if (array == null) {
            log.warn("会话 {} 请求格式错误: {}", session.getId(), request);
            return MALFORMED_REQUEST;
        }

        final RedisBytes commandName = ((BulkString) array[0]).getContent();
        try {
            final CommandType commandType = CommandType.findByBytes(commandName);
            if (commandType == null) {
                throw new UnknownCommandException(commandName.getString());
            }
            if (!commandType.acceptsArgCount(array.length)) {
                throw new WrongNumberOfArgumentsException(commandType.getCommandName());
            }

            final Command command = commandType.createCommand(new RedisContext(server, session));
            command.setContext(array);
            final Resp result = command.handle();
            if (log.isDebugEnabled()) {
                log.debug("会话 {} 执行 {} -> {}", session.getId(), commandType, result);
            }
            return result;
        } catch (RedisCommandException e) {
            log.warn("会话 {} 命令 {} 失败: {}", session.getId(), commandName, e.getMessage());
            return new Errors(e.getMessage());
        } catch (RuntimeException e) {
            log.error("会话 {} 命令 {} 执行异常", session.getId(), commandName, e);
            return new Errors("ERR " + e.getMessage());
        }
    }

    private static Resp[] toArguments(final Resp request) {
        if (!(request instanceof RespArray) || request.isNull()) {
            return null;
        }
        final Resp[] array = ((RespArray) request).getContent();
        if (array.length == 0) {
            return null;
        }
        for (final Resp element : array) {
            if (!(element instanceof BulkString) || element.isNull()) {
                return null;
            }
        }
        return array;
    }
}
