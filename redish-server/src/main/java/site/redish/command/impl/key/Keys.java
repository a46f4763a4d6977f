package site.redish.command.impl.key;

import site.redish.command.AbstractCommand;
import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.protocol.Resp;
import site.redish.server.context.RedisContext;
import site.redish.utils.GlobPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * KEYS pattern，返回匹配glob模式的所有键
 *
 * @author redish
 * @since 1.0.0
 */
public class Keys extends AbstractCommand {

    public Keys(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.KEYS;
    }

    @Override
    public Resp handle() {
        final RedisBytes pattern = arg(1);
        final List<RedisBytes> result = new ArrayList<>();
        for (final RedisBytes key : db().keys()) {
            if (GlobPattern.matches(pattern, key)) {
                result.add(key);
            }
        }
        return bulkArray(result);
    }
}
