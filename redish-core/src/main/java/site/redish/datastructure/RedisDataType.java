package site.redish.datastructure;

/**
 * 存储值的类型标签，名称与TYPE命令的返回值一致。
 *
 * @author redish
 * @since 1.0.0
 */
public enum RedisDataType {
    STRING("string"),
    HASH("hash"),
    LIST("list"),
    SET("set"),
    ZSET("zset"),
    STREAM("stream");

    private final String typeName;

    RedisDataType(final String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
