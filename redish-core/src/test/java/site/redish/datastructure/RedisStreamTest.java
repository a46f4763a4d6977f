package site.redish.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import site.redish.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisStream单元测试
 *
 * <p>覆盖ID生成和递增约束、区间查询、删除以及ID解析。
 *
 * @since 1.0.0
 */
@DisplayName("RedisStream单元测试")
class RedisStreamTest {

    private static final List<RedisBytes> FIELDS = Arrays.asList(bytes("f"), bytes("v"));

    private RedisStream stream;

    @BeforeEach
    void setUp() {
        stream = new RedisStream();
    }

    private static RedisBytes bytes(final String value) {
        return RedisBytes.fromString(value);
    }

    private StreamId add(final String id, final long now) {
        return stream.add(bytes(id), FIELDS, now);
    }

    private static List<String> ids(final List<RedisStream.StreamEntry> entries) {
        return entries.stream().map(e -> e.getId().toString()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("测试初始状态")
    void testInitialState() {
        assertEquals(RedisDataType.STREAM, stream.getType());
        assertEquals(0, stream.length());
        assertEquals(StreamId.MIN, stream.getLastId());
        assertNull(stream.firstEntry());
        assertNull(stream.lastEntry());
    }

    @Test
    @DisplayName("自动生成的ID在同一毫秒内递增序号")
    void testAutoIdWithinSameMillisecond() {
        assertEquals("1000-0", add("*", 1000).toString());
        assertEquals("1000-1", add("*", 1000).toString());
        assertEquals("1001-0", add("*", 1001).toString());

        // 时钟回拨时沿用最大时间戳
        assertEquals("1001-1", add("*", 500).toString());
        assertEquals(4, stream.getEntriesAdded());
    }

    @Test
    @DisplayName("指定时间戳、自动序号")
    void testPartialAutoId() {
        assertEquals("0-1", add("0-*", 0).toString());
        assertEquals("5-0", add("5-*", 0).toString());
        assertEquals("5-1", add("5-*", 0).toString());

        final InvalidArgumentException error = assertThrows(InvalidArgumentException.class, () -> add("4-*", 0));
        assertEquals("ERR " + RedisStream.ID_TOO_SMALL, error.getMessage());
    }

    @Test
    @DisplayName("显式ID必须大于最大ID且不能为0-0")
    void testExplicitIdMustIncrease() {
        final InvalidArgumentException zero = assertThrows(InvalidArgumentException.class, () -> add("0-0", 0));
        assertEquals("ERR The ID specified in XADD must be greater than 0-0", zero.getMessage());

        assertEquals("1-1", add("1-1", 0).toString());
        assertThrows(InvalidArgumentException.class, () -> add("1-1", 0));
        assertThrows(InvalidArgumentException.class, () -> add("1-0", 0));
        assertEquals("2-0", add("2", 0).toString());
        assertEquals(2, stream.length());
    }

    @Test
    @DisplayName("删除条目后已用过的ID不能再用")
    void testDeletedIdNotReused() {
        add("1-1", 0);
        add("1-2", 0);

        assertEquals(1, stream.delete(Arrays.asList(new StreamId(1, 2), new StreamId(9, 9))));
        assertEquals(1, stream.length());
        assertEquals("1-2", stream.getLastId().toString());
        assertThrows(InvalidArgumentException.class, () -> add("1-2", 0));

        assertEquals(1, stream.delete(Collections.singletonList(new StreamId(1, 1))));
        assertEquals(0, stream.length());
        assertEquals(2, stream.getEntriesAdded());
    }

    @Test
    @DisplayName("区间查询包含两端，COUNT限制条数")
    void testRange() {
        add("1-0", 0);
        add("1-5", 0);
        add("2-0", 0);
        add("3-7", 0);

        assertEquals(Arrays.asList("1-0", "1-5", "2-0", "3-7"), ids(stream.range(StreamId.MIN, StreamId.MAX, -1)));
        assertEquals(Arrays.asList("1-5", "2-0"), ids(stream.range(new StreamId(1, 5), new StreamId(2, 0), -1)));
        assertEquals(Arrays.asList("1-0", "1-5"),
                ids(stream.range(StreamId.parseRangeStart(bytes("1")), StreamId.parseRangeEnd(bytes("1")), -1)));
        assertEquals(Arrays.asList("1-0", "1-5"), ids(stream.range(StreamId.MIN, StreamId.MAX, 2)));
        assertTrue(stream.range(StreamId.MIN, StreamId.MAX, 0).isEmpty());
        assertTrue(stream.range(new StreamId(3, 0), new StreamId(2, 0), -1).isEmpty());
    }

    @Test
    @DisplayName("条目保留字段的写入顺序")
    void testEntryKeepsFieldOrder() {
        final List<RedisBytes> fields = Arrays.asList(bytes("z"), bytes("1"), bytes("a"), bytes("2"));
        stream.add(bytes("1-0"), fields, 0);

        assertEquals(fields, stream.firstEntry().getFieldValues());
        assertSame(stream.firstEntry(), stream.lastEntry());
    }

    @Test
    @DisplayName("字段和值不成对时不写入")
    void testOddFieldsRejected() {
        assertThrows(InvalidArgumentException.class,
                () -> stream.add(bytes("1-0"), Collections.singletonList(bytes("f")), 0));
        assertEquals(0, stream.length());
        assertEquals(StreamId.MIN, stream.getLastId());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "1-", "-1", "1-2-3", "+5", "1-x", "99999999999999999999"})
    @DisplayName("非法ID被拒绝")
    void testInvalidIds(final String id) {
        final InvalidArgumentException error = assertThrows(InvalidArgumentException.class,
                () -> StreamId.parse(bytes(id), 0));
        assertEquals("ERR " + StreamId.INVALID_ID, error.getMessage());
    }

    @Test
    @DisplayName("ID按时间戳再按序号比较")
    void testIdOrdering() {
        assertTrue(new StreamId(1, 9).compareTo(new StreamId(2, 0)) < 0);
        assertTrue(new StreamId(2, 1).compareTo(new StreamId(2, 0)) > 0);
        assertEquals(new StreamId(3, 4), StreamId.parse(bytes("3-4"), 0));
        assertEquals(new StreamId(3, Long.MAX_VALUE), StreamId.parseRangeEnd(bytes("3")));
        assertSame(StreamId.MIN, StreamId.parseRangeStart(bytes("-")));
        assertSame(StreamId.MAX, StreamId.parseRangeEnd(bytes("+")));
    }
}
