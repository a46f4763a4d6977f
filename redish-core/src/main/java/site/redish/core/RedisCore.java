package site.redish.core;

import site.redish.database.RedisDB;

/**
 * Redis核心数据接口
 *
 * <p>持有固定数量的逻辑数据库，索引为0..N-1，启动时一次性创建。
 * 当前选中的数据库属于连接会话，不在这里保存。
 *
 * @author redish
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 获取指定索引的数据库
     *
     * @param index 数据库索引
     * @return 数据库实例
     * @throws site.redish.exception.InvalidArgumentException 索引超出范围
     */
    RedisDB getDB(int index);

    /**
     * 获取数据库总数
     *
     * @return 数据库数量
     */
    int getDBNum();

    /**
     * 获取所有数据库实例
     *
     * @return 数据库实例数组
     */
    RedisDB[] getDataBases();

    /**
     * 清空所有数据库的数据
     */
    void flushAll();
}
