package site.redish.command.impl.key;

import site.redish.command.CommandType;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisData;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.server.context.RedisContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SCAN cursor [MATCH pattern] [COUNT count] [TYPE type]
 *
 * <p>回复为[下一个游标, [key ...]]。
 *
 * @author redish
 * @since 1.0.0
 */
public class Scan extends ScanCommand {

    private String typeName;

    public Scan(final RedisContext context) {
        super(context);
    }

    @Override
    public CommandType getType() {
        return CommandType.SCAN;
    }

    @Override
    protected void parseArguments() {
        parseScanArguments(1);
    }

    @Override
    protected boolean parseOption(final String option, final int valueIndex) {
        if ("TYPE".equals(option)) {
            typeName = arg(valueIndex).getString();
            return true;
        }
        return super.parseOption(option, valueIndex);
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> keys = db().keys();
        Collections.sort(keys);
        final List<RedisBytes> page = new ArrayList<>();
        for (int i = (int) Math.min(cursor, keys.size()); i < pageEnd(keys.size()); i++) {
            final RedisBytes key = keys.get(i);
            if (matches(key) && hasWantedType(key)) {
                page.add(key);
            }
        }
        return RespArray.valueOf(new Resp[]{bulk(RedisBytes.fromLong(nextCursor(keys.size()))), bulkArray(page)});
    }

    private boolean hasWantedType(final RedisBytes key) {
        if (typeName == null) {
            return true;
        }
        final RedisData data = db().get(key);
        return data != null && data.getType().getTypeName().equalsIgnoreCase(typeName);
    }
}
