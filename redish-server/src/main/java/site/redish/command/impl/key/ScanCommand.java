package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisString;
import site.redish.exception.InvalidArgumentException;
import site.redish.server.context.RedisContext;
import site.redish.utils.GlobPattern;

import java.util.Locale;

/**
 * SCAN系列命令的公共部分：游标和MATCH、COUNT选项
 *
 * <p>游标是按字节序排好的快照中的下标，0表示从头开始，也表示遍历结束。
 * 每次调用从游标处取COUNT个元素，再用MATCH过滤。
 *
 * @author redish
 * @since 1.0.0
 */
public abstract class ScanCommand extends AbstractCommand {

    private static final int DEFAULT_COUNT = 10;

    protected long cursor;

    protected RedisBytes pattern;

    protected int count = DEFAULT_COUNT;

    protected ScanCommand(final RedisContext context) {
        super(context);
    }

    /**
     * 解析游标和选项
     *
     * @param cursorIndex 游标参数的位置，选项紧随其后
     */
    protected void parseScanArguments(final int cursorIndex) {
        try {
            cursor = RedisString.parseLong(arg(cursorIndex));
        } catch (InvalidArgumentException e) {
            throw new InvalidArgumentException("invalid cursor");
        }
        if (cursor < 0) {
            throw new InvalidArgumentException("invalid cursor");
        }
        int i = cursorIndex + 1;
        while (i < argCount()) {
            final String option = arg(i).getString().toUpperCase(Locale.ROOT);
            if (i + 1 >= argCount() || !parseOption(option, i + 1)) {
                throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
            }
            i += 2;
        }
    }

    /**
     * 解析一个带值的选项，子类可以扩展
     *
     * @param option 大写的选项名
     * @param valueIndex 选项值的位置
     * @return 能识别该选项时返回true
     */
    protected boolean parseOption(final String option, final int valueIndex) {
        switch (option) {
            case "MATCH":
                pattern = arg(valueIndex);
                return true;
            case "COUNT":
                final long requested = longArg(valueIndex);
                if (requested < 1) {
                    throw new InvalidArgumentException(InvalidArgumentException.SYNTAX_ERROR);
                }
                count = (int) Math.min(requested, Integer.MAX_VALUE);
                return true;
            default:
                return false;
        }
    }

    protected boolean matches(final RedisBytes item) {
        return pattern == null || GlobPattern.matches(pattern, item);
    }

    /**
     * @param size 快照大小
     * @return 本次遍历的结束下标（不含）
     */
    protected int pageEnd(final int size) {
        return (int) Math.min(size, cursor + count);
    }

    /**
     * @param size 快照大小
     * @return 下一次调用的游标，遍历完成时为0
     */
    protected long nextCursor(final int size) {
        final long end = cursor + count;
        return end >= size ? 0 : end;
    }
}
