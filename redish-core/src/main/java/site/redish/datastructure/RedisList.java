package site.redish.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/**
 * Redis列表数据结构实现
 *
 * <p>双端队列，底层使用LinkedList，所有方法在实例上同步。
 * 批量推入在同一次加锁中完成，其他连接看不到中间状态。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisList implements RedisCollection {

    private volatile long timeout = -1;

    private final LinkedList<RedisBytes> list = new LinkedList<>();

    @Override
    public RedisDataType getType() {
        return RedisDataType.LIST;
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
     * 依次从头部插入，LPUSH a b c 之后头部元素为c
     *
     * @param values 要插入的元素
     * @return 插入后的长度
     */
    public synchronized int lpush(final List<RedisBytes> values) {
        for (final RedisBytes value : values) {
            list.addFirst(value);
        }
        return list.size();
    }

    /**
     * 依次从尾部插入
     *
     * @param values 要插入的元素
     * @return 插入后的长度
     */
    public synchronized int rpush(final List<RedisBytes> values) {
        list.addAll(values);
        return list.size();
    }

    /**
     * 从头部弹出最多count个元素
     *
     * @param count 最大弹出个数
     * @return 弹出的元素，列表为空时为空列表
     */
    public synchronized List<RedisBytes> lpop(final int count) {
        final List<RedisBytes> popped = new ArrayList<>(Math.min(count, list.size()));
        while (popped.size() < count && !list.isEmpty()) {
            popped.add(list.removeFirst());
        }
        return popped;
    }

    /**
     * 从尾部弹出最多count个元素
     *
     * @param count 最大弹出个数
     * @return 弹出的元素，按弹出顺序排列
     */
    public synchronized List<RedisBytes> rpop(final int count) {
        final List<RedisBytes> popped = new ArrayList<>(Math.min(count, list.size()));
        while (popped.size() < count && !list.isEmpty()) {
            popped.add(list.removeLast());
        }
        return popped;
    }

    /**
     * 按LRANGE语义获取区间，start和stop都包含在内，负数从末尾倒数
     *
     * @param start 起始下标
     * @param stop 结束下标
     * @return 区间内的元素
     */
    public synchronized List<RedisBytes> range(long start, long stop) {
        final int size = list.size();
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
        final List<RedisBytes> result = new ArrayList<>((int) (stop - start + 1));
        final ListIterator<RedisBytes> iterator = list.listIterator((int) start);
        for (long i = start; i <= stop; i++) {
            result.add(iterator.next());
        }
        return result;
    }

    @Override
    public synchronized int size() {
        return list.size();
    }
}
