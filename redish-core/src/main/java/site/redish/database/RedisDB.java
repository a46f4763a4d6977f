package site.redish.database;

import lombok.AccessLevel;
import lombok.Getter;
import site.redish.datastructure.RedisBytes;
import site.redish.datastructure.RedisCollection;
import site.redish.datastructure.RedisData;
import site.redish.exception.WrongTypeException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Redis数据库实现类
 *
 * <p>单个逻辑数据库，底层使用{@link ConcurrentHashMap}存储键值对：
 * <ul>
 *     <li>不同键上的操作互不阻塞，单键操作共享库级读锁</li>
 *     <li>同一个键的创建、替换、删除由map的单键原子操作保证</li>
 *     <li>值内部的修改由值对象自身串行化</li>
 *     <li>多键写入{@link #putAll}和清空持有库级写锁，
 *     其他操作看到的要么是全部写入之前，要么是之后</li>
 * </ul>
 *
 * <p>过期采用惰性删除：读到已过期的键时将其移除并视为不存在。
 * 过期时间是{@link Clock}上的绝对毫秒时间戳，-1表示永不过期。
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
public class RedisDB {

    /** 底层数据存储结构 */
    private final ConcurrentHashMap<RedisBytes, RedisData> data;

    /** 数据库标识ID */
    private final int id;

    /** 过期判断使用的时钟 */
    private final Clock clock;

    @Getter(AccessLevel.NONE)
    private final ReadWriteLock batchLock = new ReentrantReadWriteLock();

    public RedisDB(final int id) {
        this(id, Clock.systemUTC());
    }

    public RedisDB(final int id, final Clock clock) {
        this.id = id;
        this.clock = clock;
        this.data = new ConcurrentHashMap<>();
    }

    /**
     * 获取指定键的值
     *
     * @param key 要获取的键
     * @return 对应的值，键不存在或已过期时返回null
     */
    public RedisData get(final RedisBytes key) {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            return getUnlocked(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 一次读取多个键，不会看到{@link #putAll}写入一半的状态
     *
     * @param keys 键
     * @return 与keys一一对应的值，不存在的位置为null
     */
    public List<RedisData> getAll(final List<RedisBytes> keys) {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            final List<RedisData> values = new ArrayList<>(keys.size());
            for (final RedisBytes key : keys) {
                values.add(getUnlocked(key));
            }
            return values;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按类型获取值
     *
     * @param key 键
     * @param type 期望的值类型
     * @return 对应的值，键不存在时返回null
     * @throws WrongTypeException 键存在但类型不符
     */
    public <T extends RedisData> T getAs(final RedisBytes key, final Class<T> type) {
        final RedisData value = get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new WrongTypeException();
        }
        return type.cast(value);
    }

    /**
     * 获取值，不存在时用factory创建
     *
     * <p>多个调用者同时创建同一个不存在的键时，只有一个factory的结果会被保存，
     * 所有调用者拿到的都是这一个实例。
     *
     * @param key 键
     * @param factory 值工厂
     * @return 已存在或新建的值
     */
    public RedisData getOrCreate(final RedisBytes key, final Supplier<? extends RedisData> factory) {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            final RedisData existing = getUnlocked(key);
            if (existing != null) {
                return existing;
            }
            return data.compute(key, (k, current) ->
                    current == null || isExpired(current) ? factory.get() : current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在单键临界区内对值执行操作
     *
     * <p>键不存在时用factory创建，factory为null则不创建并返回null。
     * 操作结束后集合为空则删除该键。action抛出异常时映射保持不变。
     * action内不能再访问本数据库。
     *
     * @param key 键
     * @param type 期望的值类型
     * @param factory 值工厂，可以为null
     * @param action 对值执行的操作
     * @return action的返回值，键不存在且未创建时返回null
     * @throws WrongTypeException 键存在但类型不符
     */
    @SuppressWarnings("unchecked")
    public <T extends RedisData, R> R update(final RedisBytes key,
                                            final Class<T> type,
                                            final Supplier<T> factory,
                                            final Function<T, R> action) {
        final Object[] result = new Object[1];
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            data.compute(key, (k, current) -> {
                RedisData value = current;
                if (value != null && isExpired(value)) {
                    value = null;
                }
                if (value == null) {
                    if (factory == null) {
                        return null;
                    }
                    value = factory.get();
                }
                if (!type.isInstance(value)) {
                    throw new WrongTypeException();
                }
                final T typed = type.cast(value);
                result[0] = action.apply(typed);
                if (typed instanceof RedisCollection && ((RedisCollection) typed).size() == 0) {
                    return null;
                }
                return typed;
            });
        } finally {
            lock.unlock();
        }
        return (R) result[0];
    }

    /**
     * 存储键值对，整体替换已有的值
     *
     * @param key 键
     * @param value 值
     */
    public void put(final RedisBytes key, final RedisData value) {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            data.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 一次写入多个键值对，对其他操作整体可见
     *
     * @param entries 键值对，同一个键出现多次时以最后一次为准
     */
    public void putAll(final Map<RedisBytes, ? extends RedisData> entries) {
        final Lock lock = batchLock.writeLock();
        lock.lock();
        try {
            data.putAll(entries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除指定键
     *
     * @param key 要删除的键
     * @return 键存在并被删除返回true
     */
    public boolean delete(final RedisBytes key) {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            final RedisData removed = data.remove(key);
            return removed != null && !isExpired(removed);
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(final RedisBytes key) {
        return get(key) != null;
    }

    /**
     * 获取所有未过期的键
     *
     * @return 键的快照
     */
    public List<RedisBytes> keys() {
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            final List<RedisBytes> keys = new ArrayList<>(data.size());
            for (final Map.Entry<RedisBytes, RedisData> entry : data.entrySet()) {
                if (!isExpired(entry.getValue())) {
                    keys.add(entry.getKey());
                }
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 键值对数量，尚未被惰性清理的过期键也计算在内
     *
     * @return 键值对数量
     */
    public long size() {
        return data.size();
    }

    public void clear() {
        final Lock lock = batchLock.writeLock();
        lock.lock();
        try {
            data.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 设置过期时间
     *
     * @param key 键
     * @param expireAt 绝对过期时间（毫秒）
     * @return 键存在时返回true
     */
    public boolean expire(final RedisBytes key, final long expireAt) {
        final boolean[] found = new boolean[1];
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            data.computeIfPresent(key, (k, value) -> {
                if (isExpired(value)) {
                    return null;
                }
                value.setTimeout(expireAt);
                found[0] = true;
                return value;
            });
        } finally {
            lock.unlock();
        }
        return found[0];
    }

    /**
     * 移除过期时间
     *
     * @param key 键
     * @return 键存在且原本带有过期时间时返回true
     */
    public boolean persist(final RedisBytes key) {
        final boolean[] cleared = new boolean[1];
        final Lock lock = batchLock.readLock();
        lock.lock();
        try {
            data.computeIfPresent(key, (k, value) -> {
                if (isExpired(value)) {
                    return null;
                }
                if (value.timeout() >= 0) {
                    value.setTimeout(-1);
                    cleared[0] = true;
                }
                return value;
            });
        } finally {
            lock.unlock();
        }
        return cleared[0];
    }

    /**
     * 剩余生存时间
     *
     * @param key 键
     * @return -2表示键不存在，-1表示永不过期，否则为剩余毫秒数
     */
    public long ttl(final RedisBytes key) {
        final RedisData value = get(key);
        if (value == null) {
            return -2;
        }
        final long timeout = value.timeout();
        if (timeout < 0) {
            return -1;
        }
        return Math.max(0, timeout - clock.millis());
    }

    private RedisData getUnlocked(final RedisBytes key) {
        final RedisData value = data.get(key);
        if (value == null) {
            return null;
        }
        if (isExpired(value)) {
            data.remove(key, value);
            return null;
        }
        return value;
    }

    private boolean isExpired(final RedisData value) {
        final long timeout = value.timeout();
        return timeout >= 0 && timeout <= clock.millis();
    }
}
