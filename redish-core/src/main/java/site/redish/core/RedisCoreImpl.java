package site.redish.core;

import site.redish.database.RedisDB;
import site.redish.exception.InvalidArgumentException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis核心数据实现类
 *
 * <p>数据库列表在构造时创建且之后不再变化，读取无需同步。
 *
 * @author redish
 * @since 1.0.0
 */
public class RedisCoreImpl implements RedisCore {

    /** 数据库索引越界时的错误信息 */
    public static final String DB_INDEX_OUT_OF_RANGE = "DB index is out of range";

    /** 数据库列表 */
    private final List<RedisDB> databases;

    /** 数据库总数量 */
    private final int dbNum;

    public RedisCoreImpl(final int dbNum) {
        this(dbNum, Clock.systemUTC());
    }

    /**
     * 构造函数：初始化指定数量的数据库
     *
     * @param dbNum 数据库数量，必须为正数
     * @param clock 过期判断使用的时钟
     */
    public RedisCoreImpl(final int dbNum, final Clock clock) {
        if (dbNum < 1) {
            throw new IllegalArgumentException("database count must be at least 1: " + dbNum);
        }
        this.dbNum = dbNum;
        this.databases = new ArrayList<>(dbNum);
        for (int i = 0; i < dbNum; i++) {
            databases.add(new RedisDB(i, clock));
        }
    }

    @Override
    public RedisDB getDB(final int index) {
        if (index < 0 || index >= dbNum) {
            throw new InvalidArgumentException(DB_INDEX_OUT_OF_RANGE);
        }
        return databases.get(index);
    }

    @Override
    public int getDBNum() {
        return dbNum;
    }

    @Override
    public RedisDB[] getDataBases() {
        return databases.toArray(new RedisDB[0]);
    }

    @Override
    public void flushAll() {
        for (final RedisDB db : databases) {
            db.clear();
        }
    }
}
