package site.redish.command.impl.stream;

import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisStream.StreamEntry;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;

import java.util.List;

/**
 * 流条目的回复格式：[id, [field, value, ...]]
 *
 * @author redish
 * @since 1.0.0
 */
final class StreamReplies {

    private StreamReplies() {
    }

    static Resp entry(final StreamEntry entry) {
        if (entry == null) {
            return BulkString.NULL;
        }
        final List<RedisBytes> fieldValues = entry.getFieldValues();
        final Resp[] fields = new Resp[fieldValues.size()];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = BulkString.create(fieldValues.get(i));
        }
        return RespArray.valueOf(new Resp[]{BulkString.create(entry.getId().toBytes()), RespArray.valueOf(fields)});
    }

    static RespArray entries(final List<StreamEntry> entries) {
        final Resp[] elements = new Resp[entries.size()];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = entry(entries.get(i));
        }
        return RespArray.valueOf(elements);
    }
}
