package site.redish.command;

import lombok.Getter;
import site.redish.command.impl.connection.Client;
import site.redish.command.impl.connection.Echo;
import site.redish.command.impl.connection.Ping;
import site.redish.command.impl.connection.Select;
import site.redish.command.impl.hash.Hdel;
import site.redish.command.impl.hash.Hexists;
import site.redish.command.impl.hash.Hget;
import site.redish.command.impl.hash.Hgetall;
import site.redish.command.impl.hash.Hlen;
import site.redish.command.impl.hash.Hmset;
import site.redish.command.impl.hash.Hscan;
import site.redish.command.impl.hash.Hset;
import site.redish.command.impl.key.Del;
import site.redish.command.impl.key.Exists;
import site.redish.command.impl.key.Expire;
import site.redish.command.impl.key.Keys;
import site.redish.command.impl.key.Persist;
import site.redish.command.impl.key.Scan;
import site.redish.command.impl.key.Ttl;
import site.redish.command.impl.key.Type;
import site.redish.command.impl.list.Llen;
import site.redish.command.impl.list.Lpop;
import site.redish.command.impl.list.Lpush;
import site.redish.command.impl.list.Lrange;
import site.redish.command.impl.list.Rpop;
import site.redish.command.impl.list.Rpush;
import site.redish.command.impl.server.Dbsize;
import site.redish.command.impl.server.Flushall;
import site.redish.command.impl.server.Flushdb;
import site.redish.command.impl.server.Info;
import site.redish.command.impl.server.Time;
import site.redish.command.impl.set.Sadd;
import site.redish.command.impl.set.Scard;
import site.redish.command.impl.set.Sismember;
import site.redish.command.impl.set.Smembers;
import site.redish.command.impl.set.Spop;
import site.redish.command.impl.set.Srandmember;
import site.redish.command.impl.set.Srem;
import site.redish.command.impl.stream.Xadd;
import site.redish.command.impl.stream.Xdel;
import site.redish.command.impl.stream.Xinfo;
import site.redish.command.impl.stream.Xlen;
import site.redish.command.impl.stream.Xrange;
import site.redish.command.impl.string.Append;
import site.redish.command.impl.string.Decr;
import site.redish.command.impl.string.Decrby;
import site.redish.command.impl.string.Get;
import site.redish.command.impl.string.Getrange;
import site.redish.command.impl.string.Incr;
import site.redish.command.impl.string.Incrby;
import site.redish.command.impl.string.Incrbyfloat;
import site.redish.command.impl.string.Mget;
import site.redish.command.impl.string.Mset;
import site.redish.command.impl.string.Set;
import site.redish.command.impl.string.Strlen;
import site.redish.command.impl.zset.Zadd;
import site.redish.command.impl.zset.Zcard;
import site.redish.command.impl.zset.Zincrby;
import site.redish.command.impl.zset.Zrange;
import site.redish.command.impl.zset.Zrem;
import site.redish.command.impl.zset.Zscore;
import site.redish.datastructure.RedisBytes;
import site.redish.server.context.RedisContext;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Redis命令类型枚举，定义了系统支持的所有Redis命令。
 *
 * <p>每个命令带有：
 * <ul>
 *   <li>命令名，查找时大小写不敏感
 *   <li>元数：正数表示参数个数必须相等，负数表示至少为其绝对值，都包含命令名本身
 *   <li>是否为写命令
 *   <li>命令实例的工厂
 * </ul>
 *
 * @author redish
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    /** PING命令：测试服务器连接 */
    PING("PING", -1, false, Ping::new),
    /** ECHO命令：原样返回参数 */
    ECHO("ECHO", 2, false, Echo::new),
    /** SELECT命令：选择数据库 */
    SELECT("SELECT", 2, false, Select::new),
    /** CLIENT命令：查询和设置连接信息 */
    CLIENT("CLIENT", -2, false, Client::new),

    // ========== 服务器命令 ==========
    /** DBSIZE命令：获取数据库大小 */
    DBSIZE("DBSIZE", 1, false, Dbsize::new),
    /** FLUSHDB命令：清空当前数据库 */
    FLUSHDB("FLUSHDB", -1, true, Flushdb::new),
    /** FLUSHALL命令：清空所有数据库 */
    FLUSHALL("FLUSHALL", -1, true, Flushall::new),
    /** INFO命令：获取服务器信息 */
    INFO("INFO", -1, false, Info::new),
    /** TIME命令：获取服务器时间 */
    TIME("TIME", 1, false, Time::new),

    // ========== 键命令 ==========
    /** DEL命令：删除键 */
    DEL("DEL", -2, true, Del::new),
    /** EXISTS命令：统计存在的键 */
    EXISTS("EXISTS", -2, false, Exists::new),
    /** KEYS命令：查找所有匹配的键 */
    KEYS("KEYS", 2, false, Keys::new),
    /** SCAN命令：增量遍历键 */
    SCAN("SCAN", -2, false, Scan::new),
    /** TYPE命令：获取键的数据类型 */
    TYPE("TYPE", 2, false, Type::new),
    /** EXPIRE命令：设置过期时间 */
    EXPIRE("EXPIRE", 3, true, Expire::new),
    /** TTL命令：获取键的过期时间 */
    TTL("TTL", 2, false, Ttl::new),
    /** PERSIST命令：移除过期时间 */
    PERSIST("PERSIST", 2, true, Persist::new),

    // ========== 字符串命令 ==========
    /** SET命令：设置键值对 */
    SET("SET", 3, true, Set::new),
    /** GET命令：获取键值 */
    GET("GET", 2, false, Get::new),
    /** MSET命令：批量设置键值对 */
    MSET("MSET", -3, true, Mset::new),
    /** MGET命令：批量获取键值 */
    MGET("MGET", -2, false, Mget::new),
    /** INCR命令：将键值加1 */
    INCR("INCR", 2, true, Incr::new),
    /** INCRBY命令：将键值加上增量 */
    INCRBY("INCRBY", 3, true, Incrby::new),
    /** INCRBYFLOAT命令：将键值加上浮点增量 */
    INCRBYFLOAT("INCRBYFLOAT", 3, true, Incrbyfloat::new),
    /** DECR命令：将键值减1 */
    DECR("DECR", 2, true, Decr::new),
    /** DECRBY命令：将键值减去减量 */
    DECRBY("DECRBY", 3, true, Decrby::new),
    /** APPEND命令：追加字符串 */
    APPEND("APPEND", 3, true, Append::new),
    /** STRLEN命令：获取字符串长度 */
    STRLEN("STRLEN", 2, false, Strlen::new),
    /** GETRANGE命令：获取字符串子串 */
    GETRANGE("GETRANGE", 4, false, Getrange::new),

    // ========== 哈希命令 ==========
    /** HSET命令：设置哈希字段 */
    HSET("HSET", -4, true, Hset::new),
    /** HMSET命令：批量设置哈希字段 */
    HMSET("HMSET", -4, true, Hmset::new),
    /** HGET命令：获取哈希字段 */
    HGET("HGET", 3, false, Hget::new),
    /** HDEL命令：删除哈希字段 */
    HDEL("HDEL", -3, true, Hdel::new),
    /** HGETALL命令：获取所有字段和值 */
    HGETALL("HGETALL", 2, false, Hgetall::new),
    /** HLEN命令：获取字段数量 */
    HLEN("HLEN", 2, false, Hlen::new),
    /** HEXISTS命令：判断字段是否存在 */
    HEXISTS("HEXISTS", 3, false, Hexists::new),
    /** HSCAN命令：增量遍历哈希字段 */
    HSCAN("HSCAN", -3, false, Hscan::new),

    // ========== 列表命令 ==========
    /** LPUSH命令：左侧插入列表 */
    LPUSH("LPUSH", -3, true, Lpush::new),
    /** RPUSH命令：右侧插入列表 */
    RPUSH("RPUSH", -3, true, Rpush::new),
    /** LPOP命令：左侧弹出列表 */
    LPOP("LPOP", -2, true, Lpop::new),
    /** RPOP命令：右侧弹出列表 */
    RPOP("RPOP", -2, true, Rpop::new),
    /** LLEN命令：获取列表长度 */
    LLEN("LLEN", 2, false, Llen::new),
    /** LRANGE命令：获取列表范围 */
    LRANGE("LRANGE", 4, false, Lrange::new),

    // ========== 集合命令 ==========
    /** SADD命令：添加集合成员 */
    SADD("SADD", -3, true, Sadd::new),
    /** SREM命令：移除指定集合成员 */
    SREM("SREM", -3, true, Srem::new),
    /** SMEMBERS命令：获取所有成员 */
    SMEMBERS("SMEMBERS", 2, false, Smembers::new),
    /** SISMEMBER命令：判断成员是否存在 */
    SISMEMBER("SISMEMBER", 3, false, Sismember::new),
    /** SCARD命令：获取集合成员数 */
    SCARD("SCARD", 2, false, Scard::new),
    /** SPOP命令：随机移除集合成员 */
    SPOP("SPOP", -2, true, Spop::new),
    /** SRANDMEMBER命令：随机获取集合成员 */
    SRANDMEMBER("SRANDMEMBER", -2, false, Srandmember::new),

    // ========== 有序集合命令 ==========
    /** ZADD命令：添加有序集合成员 */
    ZADD("ZADD", -4, true, Zadd::new),
    /** ZREM命令：移除有序集合成员 */
    ZREM("ZREM", -3, true, Zrem::new),
    /** ZSCORE命令：获取成员分数 */
    ZSCORE("ZSCORE", 3, false, Zscore::new),
    /** ZCARD命令：获取有序集合成员数 */
    ZCARD("ZCARD", 2, false, Zcard::new),
    /** ZRANGE命令：获取有序集合范围 */
    ZRANGE("ZRANGE", -4, false, Zrange::new),
    /** ZINCRBY命令：增加成员分数 */
    ZINCRBY("ZINCRBY", 4, true, Zincrby::new),

    // ========== 流命令 ==========
    /** XADD命令：追加流条目 */
    XADD("XADD", -5, true, Xadd::new),
    /** XRANGE命令：按ID区间读取流条目 */
    XRANGE("XRANGE", -4, false, Xrange::new),
    /** XLEN命令：获取流条目数 */
    XLEN("XLEN", 2, false, Xlen::new),
    /** XDEL命令：删除流条目 */
    XDEL("XDEL", -3, true, Xdel::new),
    /** XINFO命令：查询流信息 */
    XINFO("XINFO", -2, false, Xinfo::new);

    /** 命令查找缓存，键为大写命令名 */
    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    /** 命令名 */
    private final String commandName;

    /** 命令字节数组 */
    private final RedisBytes commandBytes;

    /** 元数，包含命令名本身 */
    private final int arity;

    /** 是否为写命令 */
    private final boolean write;

    @Getter(lombok.AccessLevel.NONE)
    private final Function<RedisContext, Command> factory;

    CommandType(final String commandName, final int arity, final boolean write,
                final Function<RedisContext, Command> factory) {
        this.commandName = commandName;
        this.commandBytes = RedisBytes.fromString(commandName);
        this.arity = arity;
        this.write = write;
        this.factory = factory;
    }

    /**
     * 根据命令名查找命令类型，大小写不敏感。
     *
     * @param commandBytes 命令名
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        return COMMAND_CACHE.get(commandBytes.toUpperCase());
    }

    /**
     * 检查参数个数是否符合元数
     *
     * @param argCount 包含命令名在内的参数个数
     * @return 符合时返回true
     */
    public boolean acceptsArgCount(final int argCount) {
        return arity >= 0 ? argCount == arity : argCount >= -arity;
    }

    /**
     * 使用上下文创建命令实例。
     *
     * @param context 本次执行的上下文
     * @return 命令实例
     */
    public Command createCommand(final RedisContext context) {
        return factory.apply(context);
    }
}
