package site.redish.datastructure;

/**
 * Redis数据结构基础接口
 *
 * <p>一个实例只属于一个数据库中的一个键。类型改变的写操作（例如SET覆盖哈希）
 * 替换整个实例，而不是就地转换。
 *
 * <p>线程安全性：
 * <ul>
 *     <li>不同连接的命令并发执行，每个实现类自行保证单个操作的原子性</li>
 *     <li>创建和删除键由{@link site.redish.database.RedisDB}在键级别串行化</li>
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
public interface RedisData {

    /**
     * 获取类型标签
     *
     * @return 类型标签
     */
    RedisDataType getType();

    /**
     * 获取过期时间
     *
     * @return 过期时间戳（毫秒），-1表示永不过期
     */
    long timeout();

    /**
     * 设置过期时间
     *
     * @param timeout 过期时间戳（毫秒），-1表示永不过期
     */
    void setTimeout(long timeout);
}
