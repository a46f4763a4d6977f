package site.redish.datastructure;

/**
 * 集合类值（哈希、列表、集合、有序集合）。命令执行后集合为空时所在的键会被删除。
 *
 * @author redish
 * @since 1.0.0
 */
public interface RedisCollection extends RedisData {

    /**
     * 当前元素个数
     *
     * @return 元素个数
     */
    int size();
}
