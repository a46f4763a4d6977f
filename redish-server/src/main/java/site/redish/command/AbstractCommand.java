package site.redish.command;

import site.redish.database.RedisDB;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.exception.InvalidArgumentException;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令实现的公共基类，提供参数读取和回复构造的辅助方法。
 *
 * @author redish
 * @since 1.0.0
 */
public abstract class AbstractCommand implements Command {

    protected final RedisContext context;

    protected Resp[] args;

    protected AbstractCommand(final RedisContext context) {
        this.context = context;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.args = array;
        parseArguments();
    }

    /**
     * 解析并校验参数，在访问数据库之前调用
     */
    protected void parseArguments() {
    }

    @Override
    public boolean isWriteCommand() {
        return getType().isWrite();
    }

    protected RedisDB db() {
        return context.getDB();
    }

    protected int argCount() {
        return args.length;
    }

    protected RedisBytes arg(final int index) {
        return ((BulkString) args[index]).getContent();
    }

    protected List<RedisBytes> argsFrom(final int from) {
        final List<RedisBytes> result = new ArrayList<>(Math.max(0, args.length - from));
        for (int i = from; i < args.length; i++) {
            result.add(arg(i));
        }
        return result;
    }

    protected long longArg(final int index) {
        return RedisString.parseLong(arg(index));
    }

    protected double doubleArg(final int index) {
        return parseDouble(arg(index));
    }

    /**
     * 解析分数，接受inf、+inf、-inf，拒绝NaN
     *
     * @param bytes 待解析内容
     * @return 解析结果
     */
    protected static double parseDouble(final RedisBytes bytes) {
        final String text = bytes.getString();
        final double value;
        if ("inf".equalsIgnoreCase(text) || "+inf".equalsIgnoreCase(text)) {
            value = Double.POSITIVE_INFINITY;
        } else if ("-inf".equalsIgnoreCase(text)) {
            value = Double.NEGATIVE_INFINITY;
        } else {
            if (text.isEmpty() || Character.isWhitespace(text.charAt(0))
                    || Character.isWhitespace(text.charAt(text.length() - 1))) {
                throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
            }
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
            }
        }
        if (Double.isNaN(value)) {
            throw new InvalidArgumentException(InvalidArgumentException.NOT_A_FLOAT);
        }
        return value;
    }

    /**
     * 分数的文本形式，整数值不带小数部分
     *
     * @param value 分数
     * @return 文本形式
     */
    protected static RedisBytes formatDouble(final double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return RedisBytes.fromString("inf");
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return RedisBytes.fromString("-inf");
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e17) {
            return RedisBytes.fromLong((long) value);
        }
        return RedisBytes.fromString(Double.toString(value));
    }

    /**
     * 批量字符串回复，null对应null批量字符串
     */
    protected static BulkString bulk(final RedisBytes value) {
        return value == null ? BulkString.NULL : BulkString.create(value);
    }

    protected static RespArray bulkArray(final List<RedisBytes> values) {
        final Resp[] elements = new Resp[values.size()];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = bulk(values.get(i));
        }
        return RespArray.valueOf(elements);
    }
}
