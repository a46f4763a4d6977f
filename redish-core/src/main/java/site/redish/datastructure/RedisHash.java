package site.redish.datastructure;

import site.redish.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis哈希表数据结构实现类
 *
 * <p>字段到值的映射，所有读写都在实例锁内完成：
 * <ul>
 *     <li>{@link #setField}的"字段此前不存在"判断与写入在同一临界区内</li>
 *     <li>{@link #setFields}和{@link #removeFields}对读者整体可见，不会读到一半</li>
 *     <li>{@link #getAll}返回扁平的[field, value, ...]快照，长度总是偶数</li>
 * </ul>
 *
 * <p>字段名或值为null时抛出{@link InvalidArgumentException}。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisHash implements RedisCollection {

    private volatile long timeout = -1;

    private final Map<RedisBytes, RedisBytes> hash = new HashMap<>();

    @Override
    public RedisDataType getType() {
        return RedisDataType.HASH;
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
     * 设置字段值
     *
     * @param field 字段名
     * @param value 字段值
     * @return 调用前字段不存在时返回true，覆盖已有字段时返回false
     */
    public synchronized boolean setField(final RedisBytes field, final RedisBytes value) {
        requireField(field);
        requireValue(value);
        return hash.put(field, value) == null;
    }

    /**
     * 批量设置字段，一次性生效
     *
     * @param fieldValues [field, value, field, value, ...]
     * @return 新增字段的个数
     */
    public synchronized int setFields(final List<RedisBytes> fieldValues) {
        if (fieldValues.size() % 2 != 0) {
            throw new InvalidArgumentException("hash fields and values must come in pairs");
        }
        for (int i = 0; i < fieldValues.size(); i += 2) {
            requireField(fieldValues.get(i));
            requireValue(fieldValues.get(i + 1));
        }
        int added = 0;
        for (int i = 0; i < fieldValues.size(); i += 2) {
            if (hash.put(fieldValues.get(i), fieldValues.get(i + 1)) == null) {
                added++;
            }
        }
        return added;
    }

    /**
     * 获取字段值
     *
     * @param field 字段名
     * @return 字段值，字段不存在时返回null（与空字符串不同）
     */
    public synchronized RedisBytes getField(final RedisBytes field) {
        requireField(field);
        return hash.get(field);
    }

    /**
     * 删除字段
     *
     * @param field 字段名
     * @return 字段存在并被删除时返回true
     */
    public synchronized boolean removeField(final RedisBytes field) {
        requireField(field);
        return hash.remove(field) != null;
    }

    /**
     * 批量删除字段
     *
     * @param fields 要删除的字段
     * @return 实际删除的字段数量
     */
    public synchronized int removeFields(final Collection<RedisBytes> fields) {
        fields.forEach(RedisHash::requireField);
        int removed = 0;
        for (final RedisBytes field : fields) {
            if (hash.remove(field) != null) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized boolean containsField(final RedisBytes field) {
        requireField(field);
        return hash.containsKey(field);
    }

    public synchronized int fieldCount() {
        return hash.size();
    }

    /**
     * 获取所有字段和值的扁平快照
     *
     * @return [field, value, field, value, ...]
     */
    public synchronized List<RedisBytes> getAll() {
        final List<RedisBytes> result = new ArrayList<>(hash.size() * 2);
        for (final Map.Entry<RedisBytes, RedisBytes> entry : hash.entrySet()) {
            result.add(entry.getKey());
            result.add(entry.getValue());
        }
        return result;
    }

    @Override
    public synchronized int size() {
        return hash.size();
    }

    private static void requireField(final RedisBytes field) {
        if (field == null) {
            throw new InvalidArgumentException("hash field must not be null");
        }
    }

    private static void requireValue(final RedisBytes value) {
        if (value == null) {
            throw new InvalidArgumentException("hash value must not be null");
        }
    }
}
