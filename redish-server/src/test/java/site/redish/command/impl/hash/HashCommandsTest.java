package site.redish.command.impl.hash;

import org.junit.jupiter.api.Test;
import site.redish.command.CommandTestSupport;
import site.redish.protocol.RespArray;
import site.redish.server.session.ClientSession;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HashCommandsTest extends CommandTestSupport {

    @Test
    void testHsetReportsNewFields() {
        // 新字段返回1，更新已有字段返回0
        assertInteger(1, exec("HSET", "user:1", "name", "alice"));
        assertInteger(0, exec("HSET", "user:1", "name", "bob"));
        assertInteger(2, exec("HSET", "user:1", "name", "carol", "age", "30", "city", "paris"));

        assertBulk("carol", exec("HGET", "user:1", "name"));
        assertInteger(3, exec("HLEN", "user:1"));
    }

    @Test
    void testHgetMissing() {
        assertNullBulk(exec("HGET", "missing", "f"));

        assertInteger(1, exec("HSET", "h", "f", "v"));
        assertNullBulk(exec("HGET", "h", "other"));
    }

    @Test
    void testEmptyFieldValue() {
        assertInteger(1, exec("HSET", "h", "f", ""));
        assertBulk("", exec("HGET", "h", "f"));
        assertInteger(1, exec("HEXISTS", "h", "f"));
    }

    @Test
    void testHmset() {
        assertOk(exec("HMSET", "h", "a", "1", "b", "2"));
        assertInteger(2, exec("HLEN", "h"));
        assertError("ERR wrong number of arguments for 'hmset' command", exec("HMSET", "h", "a", "1", "b"));
    }

    @Test
    void testHgetall() {
        assertSame(RespArray.EMPTY, exec("HGETALL", "missing"));

        assertInteger(2, exec("HSET", "h", "a", "1", "b", "2"));
        final List<String> pairs = toStrings(exec("HGETALL", "h"));

        assertEquals(4, pairs.size());
        for (int i = 0; i < pairs.size(); i += 2) {
            final String field = pairs.get(i);
            assertEquals("a".equals(field) ? "1" : "2", pairs.get(i + 1));
        }
    }

    @Test
    void testHdelRemovesEmptyHash() {
        assertInteger(2, exec("HSET", "h", "a", "1", "b", "2"));

        assertInteger(1, exec("HDEL", "h", "a", "missing"));
        assertInteger(0, exec("HEXISTS", "h", "a"));
        assertInteger(1, exec("HDEL", "h", "b"));

        // 最后一个字段删除后键消失
        assertInteger(0, exec("EXISTS", "h"));
        assertSimple("none", exec("TYPE", "h"));
        assertInteger(0, exec("HDEL", "h", "b"));
    }

    @Test
    void testHlenAndHexistsOnMissingKey() {
        assertInteger(0, exec("HLEN", "missing"));
        assertInteger(0, exec("HEXISTS", "missing", "f"));
    }

    @Test
    void testHgetallNeverSeesPartialHsetOrHdel() throws Exception {
        final ClientSession writerSession = newSession();
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        final AtomicBoolean running = new AtomicBoolean(true);
        try {
            // 另一个连接反复写入和删除全部四个字段
            final Future<?> writer = executor.submit(() -> {
                while (running.get()) {
                    exec(writerSession, "HSET", "h", "a", "1", "b", "1", "c", "1", "d", "1");
                    exec(writerSession, "HDEL", "h", "a", "b", "c", "d");
                }
            });

            for (int i = 0; i < 200_000; i++) {
                final int length = toStrings(exec("HGETALL", "h")).size();
                assertTrue(length == 0 || length == 8, "partial hash observed: " + length);
            }
            running.set(false);
            writer.get(30, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            executor.shutdownNow();
        }
    }

    @Test
    void testHscanPagesThroughFields() {
        for (int i = 0; i < 15; i++) {
            exec("HSET", "h", "f" + (char) ('a' + i), String.valueOf(i));
        }

        final RespArray first = (RespArray) exec("HSCAN", "h", "0", "COUNT", "10");
        assertBulk("10", first.getContent()[0]);
        final List<String> pairs = toStrings(first.getContent()[1]);
        assertEquals(20, pairs.size());
        assertEquals("fa", pairs.get(0));
        assertEquals("0", pairs.get(1));

        final RespArray second = (RespArray) exec("HSCAN", "h", "10", "COUNT", "10");
        assertBulk("0", second.getContent()[0]);
        assertEquals(10, toStrings(second.getContent()[1]).size());
    }

    @Test
    void testHscanMatchAndMissingKey() {
        assertInteger(3, exec("HSET", "h", "name", "alice", "nick", "al", "age", "30"));

        final RespArray matched = (RespArray) exec("HSCAN", "h", "0", "MATCH", "n*");
        assertBulk("0", matched.getContent()[0]);
        assertEquals(list("name", "alice", "nick", "al"), toStrings(matched.getContent()[1]));

        final RespArray missing = (RespArray) exec("HSCAN", "missing", "0");
        assertBulk("0", missing.getContent()[0]);
        assertBulkArray(list(), missing.getContent()[1]);

        assertOk(exec("SET", "s", "v"));
        assertErrorStartsWith("WRONGTYPE", exec("HSCAN", "s", "0"));
    }
}
