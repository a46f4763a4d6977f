package site.redish.datastructure;

import lombok.Getter;
import site.redish.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Redis流数据结构实现
 *
 * <p>按ID升序保存的条目序列，每个条目是若干字段值对。新条目的ID必须大于
 * 已生成过的最大ID，删除条目不会让已用过的ID重新可用。
 *
 * <p>与列表、集合不同，流在条目全部删除后仍然保留。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisStream implements RedisData {

    public static final String ID_TOO_SMALL =
            "The ID specified in XADD is equal or smaller than the target stream top item";

    public static final String ID_ZERO = "The ID specified in XADD must be greater than 0-0";

    private volatile long timeout = -1;

    private final NavigableMap<StreamId, StreamEntry> entries = new TreeMap<>();

    private StreamId lastId = StreamId.MIN;

    private long entriesAdded;

    @Override
    public RedisDataType getType() {
        return RedisDataType.STREAM;
    }

    @Override
    public long timeout() {
        return timeout;
    }

    @Override
    public void setTimeout(final long timeout) {
        this.timeout = timeout;
    }

    /**
     * 追加条目
     *
     * <p>id可以是"*"（按当前时间生成）、"ms-*"（指定时间戳，自动序号）或完整ID。
     *
     * @param id 请求的ID
     * @param fieldValues [field, value, ...]
     * @param nowMillis 当前时间，用于"*"
     * @return 实际使用的ID
     * @throws InvalidArgumentException ID格式不合法或不大于已有的最大ID
     */
    public synchronized StreamId add(final RedisBytes id, final List<RedisBytes> fieldValues, final long nowMillis) {
        if (fieldValues.isEmpty() || fieldValues.size() % 2 != 0) {
            throw new InvalidArgumentException("stream fields and values must come in pairs");
        }
        final StreamId next = nextId(id.getString(), nowMillis);
        entries.put(next, new StreamEntry(next, fieldValues));
        lastId = next;
        entriesAdded++;
        return next;
    }

    private StreamId nextId(final String requested, final long nowMillis) {
        if ("*".equals(requested)) {
            final long millis = Math.max(nowMillis, lastId.getMillis());
            if (millis == lastId.getMillis()) {
                return increment(lastId);
            }
            return new StreamId(millis, 0);
        }
        if (requested.endsWith("-*")) {
            final long millis = StreamId.parsePart(requested.substring(0, requested.length() - 2));
            if (millis < lastId.getMillis()) {
                throw new InvalidArgumentException(ID_TOO_SMALL);
            }
            if (millis == lastId.getMillis()) {
                if (lastId.getSequence() == Long.MAX_VALUE) {
                    throw new InvalidArgumentException(ID_TOO_SMALL);
                }
                return new StreamId(millis, lastId.getSequence() + 1);
            }
            return new StreamId(millis, 0);
        }
        final StreamId explicit = StreamId.parse(RedisBytes.fromString(requested), 0);
        if (explicit.equals(StreamId.MIN)) {
            throw new InvalidArgumentException(ID_ZERO);
        }
        if (explicit.compareTo(lastId) <= 0) {
            throw new InvalidArgumentException(ID_TOO_SMALL);
        }
        return explicit;
    }

    private static StreamId increment(final StreamId id) {
        if (id.getSequence() == Long.MAX_VALUE) {
            if (id.getMillis() == Long.MAX_VALUE) {
                throw new InvalidArgumentException(ID_TOO_SMALL);
            }
            return new StreamId(id.getMillis() + 1, 0);
        }
        return new StreamId(id.getMillis(), id.getSequence() + 1);
    }

    /**
     * 闭区间[start, end]内的条目，按ID升序
     *
     * @param start 起点
     * @param end 终点
     * @param count 最多返回的条数，负数表示不限制
     * @return 条目快照
     */
    public synchronized List<StreamEntry> range(final StreamId start, final StreamId end, final long count) {
        if (start.compareTo(end) > 0 || count == 0) {
            return Collections.emptyList();
        }
        final List<StreamEntry> result = new ArrayList<>();
        for (final StreamEntry entry : entries.subMap(start, true, end, true).values()) {
            if (count > 0 && result.size() >= count) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * 删除条目
     *
     * @param ids 要删除的ID
     * @return 实际删除的条数
     */
    public synchronized int delete(final Collection<StreamId> ids) {
        int removed = 0;
        for (final StreamId id : ids) {
            if (entries.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized int length() {
        return entries.size();
    }

    public synchronized StreamId getLastId() {
        return lastId;
    }

    /**
     * @return 创建以来追加过的条目总数，包括已删除的
     */
    public synchronized long getEntriesAdded() {
        return entriesAdded;
    }

    public synchronized StreamEntry firstEntry() {
        final Map.Entry<StreamId, StreamEntry> first = entries.firstEntry();
        return first == null ? null : first.getValue();
    }

    public synchronized StreamEntry lastEntry() {
        final Map.Entry<StreamId, StreamEntry> last = entries.lastEntry();
        return last == null ? null : last.getValue();
    }

    /**
     * 流中的一个条目
     */
    @Getter
    public static final class StreamEntry {
        private final StreamId id;
        /** [field, value, ...]，保持写入时的顺序 */
        private final List<RedisBytes> fieldValues;

        StreamEntry(final StreamId id, final List<RedisBytes> fieldValues) {
            this.id = id;
            this.fieldValues = Collections.unmodifiableList(new ArrayList<>(fieldValues));
        }
    }
}
