package site.redish.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis集合数据结构实现
 *
 * <p>所有读写都在实例锁内完成，批量添加、删除和弹出对读者整体可见，
 * 同一个成员只会被一个SPOP调用者弹出。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisSet implements RedisCollection {

    private volatile long timeout = -1;

    private final Set<RedisBytes> members = new HashSet<>();

    @Override
    public RedisDataType getType() {
        return RedisDataType.SET;
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
     * 添加成员
     *
     * @param values 要添加的成员
     * @return 新加入的成员个数
     */
    public synchronized int add(final List<RedisBytes> values) {
        int added = 0;
        for (final RedisBytes value : values) {
            if (members.add(value)) {
                added++;
            }
        }
        return added;
    }

    /**
     * 移除成员
     *
     * @param values 要移除的成员
     * @return 实际移除的成员个数
     */
    public synchronized int remove(final List<RedisBytes> values) {
        int removed = 0;
        for (final RedisBytes value : values) {
            if (members.remove(value)) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized boolean contains(final RedisBytes value) {
        return members.contains(value);
    }

    /**
     * 所有成员的快照
     *
     * @return 成员列表
     */
    public synchronized List<RedisBytes> members() {
        return new ArrayList<>(members);
    }

    /**
     * 随机弹出最多count个成员
     *
     * @param count 最大弹出个数
     * @return 弹出的成员
     */
    public synchronized List<RedisBytes> pop(final int count) {
        final List<RedisBytes> popped = new ArrayList<>();
        while (popped.size() < count && !members.isEmpty()) {
            final RedisBytes candidate = pickRandom();
            members.remove(candidate);
            popped.add(candidate);
        }
        return popped;
    }

    /**
     * 随机取成员但不移除
     *
     * @param count 正数取不重复的最多count个，负数取|count|个且可以重复
     * @return 选中的成员
     */
    public synchronized List<RedisBytes> randomMembers(final int count) {
        final List<RedisBytes> result = new ArrayList<>();
        if (members.isEmpty() || count == 0) {
            return result;
        }
        final List<RedisBytes> all = new ArrayList<>(members);
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        if (count < 0) {
            for (long i = 0; i < -(long) count; i++) {
                result.add(all.get(random.nextInt(all.size())));
            }
            return result;
        }
        Collections.shuffle(all, random);
        result.addAll(all.subList(0, Math.min(count, all.size())));
        return result;
    }

    private RedisBytes pickRandom() {
        final int size = members.size();
        if (size == 0) {
            return null;
        }
        int skip = ThreadLocalRandom.current().nextInt(size);
        final Iterator<RedisBytes> iterator = members.iterator();
        RedisBytes current = null;
        while (iterator.hasNext() && skip-- >= 0) {
            current = iterator.next();
        }
        return current;
    }

    @Override
    public synchronized int size() {
        return members.size();
    }
}
