package site.redish.datastructure;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import site.redish.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Redis有序集合数据结构实现
 *
 * <p>成员到分数的映射加上按(分数, 成员字节序)排序的索引，两者在实例锁内
 * 同步更新，按排名查询时无需排序。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisZset implements RedisCollection {

    private static final Comparator<ZsetEntry> ORDER = Comparator
            .comparingDouble(ZsetEntry::getScore)
            .thenComparing(ZsetEntry::getMember);

    private volatile long timeout = -1;

    private final Map<RedisBytes, Double> scores = new HashMap<>();

    private final TreeSet<ZsetEntry> index = new TreeSet<>(ORDER);

    @Override
    public RedisDataType getType() {
        return RedisDataType.ZSET;
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
     * 添加成员或更新已有成员的分数
     *
     * @param score 分数
     * @param member 成员
     * @return 新成员返回true，更新已有成员返回false
     */
    public synchronized boolean add(final double score, final RedisBytes member) {
        final Double previous = scores.put(member, score);
        if (previous != null) {
            index.remove(new ZsetEntry(member, previous));
        }
        index.add(new ZsetEntry(member, score));
        return previous == null;
    }

    /**
     * 给成员的分数加上增量，成员不存在时以0为初始分数
     *
     * @param delta 增量
     * @param member 成员
     * @return 新的分数
     * @throws InvalidArgumentException 结果为NaN，例如inf加-inf
     */
    public synchronized double incrBy(final double delta, final RedisBytes member) {
        final Double previous = scores.get(member);
        final double updated = previous == null ? delta : previous + delta;
        if (Double.isNaN(updated)) {
            throw new InvalidArgumentException("resulting score is not a number (NaN)");
        }
        add(updated, member);
        return updated;
    }

    /**
     * 移除成员
     *
     * @param members 要移除的成员
     * @return 实际移除的个数
     */
    public synchronized int remove(final Collection<RedisBytes> members) {
        int removed = 0;
        for (final RedisBytes member : members) {
            final Double score = scores.remove(member);
            if (score != null) {
                index.remove(new ZsetEntry(member, score));
                removed++;
            }
        }
        return removed;
    }

    /**
     * 获取成员分数
     *
     * @param member 成员
     * @return 分数，成员不存在时返回null
     */
    public synchronized Double score(final RedisBytes member) {
        return scores.get(member);
    }

    /**
     * 按排名获取区间，语义同ZRANGE
     *
     * @param start 起始排名
     * @param stop 结束排名
     * @return 区间内的成员和分数，按分数升序
     */
    public synchronized List<ZsetEntry> range(long start, long stop) {
        final int size = index.size();
        if (start < 0) {
            start = Math.max(0, size + start);
        }
        if (stop < 0) {
            stop = size + stop;
        }
        if (stop >= size) {
            stop = size - 1;
        }
        if (start > stop || start >= size) {
            return Collections.emptyList();
        }
        final List<ZsetEntry> result = new ArrayList<>((int) (stop - start + 1));
        final Iterator<ZsetEntry> iterator = index.iterator();
        for (long rank = 0; rank <= stop; rank++) {
            final ZsetEntry entry = iterator.next();
            if (rank >= start) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized int size() {
        return scores.size();
    }

    /**
     * 有序集合中的一个成员及其分数
     */
    @Getter
    @RequiredArgsConstructor
    public static final class ZsetEntry {
        private final RedisBytes member;
        private final double score;
    }
}
