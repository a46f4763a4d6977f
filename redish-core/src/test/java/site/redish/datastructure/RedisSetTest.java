package site.redish.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisSet单元测试")
class RedisSetTest {

    private RedisSet redisSet;

    @BeforeEach
    void setUp() {
        redisSet = new RedisSet();
    }

    private static List<RedisBytes> bytes(final String... values) {
        return Arrays.stream(values).map(RedisBytes::fromString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("重复成员只计一次")
    void testAddCountsNewMembers() {
        assertEquals(2, redisSet.add(bytes("a", "b", "a")));
        assertEquals(1, redisSet.add(bytes("b", "c")));
        assertEquals(3, redisSet.size());
        assertTrue(redisSet.contains(RedisBytes.fromString("c")));
    }

    @Test
    @DisplayName("测试移除成员")
    void testRemove() {
        redisSet.add(bytes("a", "b"));

        assertEquals(1, redisSet.remove(bytes("a", "missing")));
        assertEquals(new HashSet<>(bytes("b")), new HashSet<>(redisSet.members()));
    }

    @Test
    @DisplayName("弹出的成员来自集合且不重复")
    void testPop() {
        redisSet.add(bytes("a", "b", "c", "d"));

        final List<RedisBytes> popped = redisSet.pop(3);

        assertEquals(3, popped.size());
        assertEquals(3, new HashSet<>(popped).size());
        assertTrue(bytes("a", "b", "c", "d").containsAll(popped));
        assertEquals(1, redisSet.size());
        assertEquals(1, redisSet.pop(5).size());
        assertTrue(redisSet.pop(1).isEmpty());
    }

    @Test
    @DisplayName("正数count返回不重复成员，负数count允许重复")
    void testRandomMembers() {
        redisSet.add(bytes("a", "b", "c"));

        final List<RedisBytes> distinct = redisSet.randomMembers(2);
        assertEquals(2, distinct.size());
        assertEquals(2, new HashSet<>(distinct).size());
        assertEquals(3, redisSet.randomMembers(10).size());

        final List<RedisBytes> repeated = redisSet.randomMembers(-7);
        assertEquals(7, repeated.size());
        assertTrue(bytes("a", "b", "c").containsAll(repeated));

        assertTrue(redisSet.randomMembers(0).isEmpty());
        assertTrue(new RedisSet().randomMembers(-3).isEmpty());
        assertEquals(3, redisSet.size());
    }

    @Test
    @DisplayName("批量添加和批量移除对并发读者整体可见")
    void testBatchWritesNotObservedHalfDone() throws Exception {
        final List<RedisBytes> members = bytes("a", "b", "c", "d");
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        final AtomicBoolean running = new AtomicBoolean(true);
        try {
            final Future<?> writer = executor.submit(() -> {
                while (running.get()) {
                    redisSet.add(members);
                    redisSet.remove(members);
                }
            });

            for (int i = 0; i < 200_000; i++) {
                final int size = redisSet.members().size();
                assertTrue(size == 0 || size == 4, "partial set observed: " + size);
            }
            running.set(false);
            writer.get(30, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            executor.shutdownNow();
        }
    }
}
