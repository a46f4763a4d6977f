package site.redish.command.impl.hash;

import site.redish.command.CommandType;
import site.redish.command.impl.key.ScanCommand;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisHash;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * HSCAN key cursor [MATCH pattern] [COUNT count]
 *
 * <p>按字段名遍历，回复为[下一个游标, [field, value, ...]]。键不存在时返回["0", []]。
 *
 * @author redish
 * @since 1.0.0
 */
public class Hscan extends ScanCommand {

    public Hscan(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.HSCAN;
    }

    @Override
    protected void parseArguments() {
        parseScanArguments(2);
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().getAs(arg(1), RedisHash.class);
        final TreeMap<RedisBytes, RedisBytes> sorted = new TreeMap<>();
        if (hash != null) {
            final List<RedisBytes> pairs = hash.getAll();
            for (int i = 0; i < pairs.size(); i += 2) {
                sorted.put(pairs.get(i), pairs.get(i + 1));
            }
        }
        final List<RedisBytes> page = new ArrayList<>();
        final int end = pageEnd(sorted.size());
        int index = 0;
        for (final Map.Entry<RedisBytes, RedisBytes> entry : sorted.entrySet()) {
            if (index >= end) {
                break;
            }
            if (index >= cursor && matches(entry.getKey())) {
                page.add(entry.getKey());
                page.add(entry.getValue());
            }
            index++;
        }
        return RespArray.valueOf(new Resp[]{bulk(RedisBytes.fromLong(nextCursor(sorted.size()))), bulkArray(page)});
    }
}
