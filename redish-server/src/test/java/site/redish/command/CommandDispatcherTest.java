package site.redish.command;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import site.redish.datastructure.RedisHash;
import site.redish.datastructure.RedisString;
import site.redish.protocol.BulkString;
import site.redish.protocol.Resp;
import site.redish.protocol.RespArray;
import site.redish.protocol.RespInteger;
import site.redish.protocol.SimpleString;
import site.redish.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest extends CommandTestSupport {

    @Test
    @DisplayName("未知命令返回错误，连接可以继续使用")
    void testUnknownCommand() {
        // 执行未知命令
        assertError("ERR unknown command 'FOO'", exec("FOO", "bar"));

        // 后续命令正常执行
        assertSame(SimpleString.PONG, exec("PING"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"hset", "HSET", "HsEt"})
    @DisplayName("命令名不区分大小写")
    void testCaseInsensitiveCommandName(final String name) {
        assertInteger(1, exec(name, "user:1", "name", "alice"));
        assertBulk("alice", exec("hget", "user:1", "name"));
    }

    @Test
    @DisplayName("参数个数错误")
    void testWrongArity() {
        assertError("ERR wrong number of arguments for 'get' command", exec("GET"));
        assertError("ERR wrong number of arguments for 'get' command", exec("GET", "a", "b"));
        assertError("ERR wrong number of arguments for 'hset' command", exec("HSET", "h", "f"));
        assertError("ERR wrong number of arguments for 'hset' command", exec("HSET", "h", "f", "v", "g"));
        assertError("ERR wrong number of arguments for 'mset' command", exec("MSET", "a", "1", "b"));
    }

    @Test
    @DisplayName("请求不是批量字符串数组")
    void testMalformedRequest() {
        assertSame(CommandDispatcher.MALFORMED_REQUEST, dispatcher.dispatch(session, SimpleString.OK));
        assertSame(CommandDispatcher.MALFORMED_REQUEST, dispatcher.dispatch(session, RespArray.NULL));
        assertSame(CommandDispatcher.MALFORMED_REQUEST, dispatcher.dispatch(session, RespArray.EMPTY));
        assertSame(CommandDispatcher.MALFORMED_REQUEST, dispatcher.dispatch(session,
                new RespArray(new Resp[]{BulkString.fromString("GET"), RespInteger.ONE})));
        assertSame(CommandDispatcher.MALFORMED_REQUEST, dispatcher.dispatch(session,
                new RespArray(new Resp[]{BulkString.fromString("GET"), BulkString.NULL})));
    }

    @Test
    @DisplayName("类型不匹配返回WRONGTYPE且不修改原值")
    void testWrongTypeLeavesValueUnchanged() {
        assertOk(exec("SET", "k", "v"));

        assertError("WRONGTYPE Operation against a key holding the wrong kind of value",
                exec("HSET", "k", "f", "x"));
        assertError("WRONGTYPE Operation against a key holding the wrong kind of value",
                exec("LPUSH", "k", "x"));

        // 原值保持不变
        assertBulk("v", exec("GET", "k"));
        assertInstanceOf(RedisString.class, redisCore.getDB(0).get(bytes("k")));
    }

    @Test
    @DisplayName("命令写入的是会话选中的数据库")
    void testCommandsUseSelectedDatabase() {
        assertOk(exec("SELECT", "2"));
        assertInteger(1, exec("HSET", "h", "f", "v"));

        assertTrue(redisCore.getDB(2).get(bytes("h")) instanceof RedisHash);
        assertNull(redisCore.getDB(0).get(bytes("h")));
    }

    @Test
    @DisplayName("SELECT只影响当前会话")
    void testSelectIsPerSession() {
        final ClientSession other = newSession();

        assertOk(exec("SELECT", "1"));
        assertOk(exec("SET", "k", "one"));
        assertOk(exec(other, "SET", "k", "zero"));

        assertBulk("one", exec("GET", "k"));
        assertBulk("zero", exec(other, "GET", "k"));
        assertEquals(1, session.getDbIndex());
        assertEquals(0, other.getDbIndex());
    }

    @Test
    @DisplayName("SELECT越界不改变当前数据库")
    void testSelectOutOfRange() {
        assertOk(exec("SELECT", "1"));

        assertError("ERR DB index is out of range", exec("SELECT", String.valueOf(DATABASE_COUNT)));
        assertError("ERR DB index is out of range", exec("SELECT", "-1"));
        assertError("ERR value is not an integer or out of range", exec("SELECT", "abc"));

        assertEquals(1, session.getDbIndex());
    }

    @Test
    @DisplayName("错误回复中的客户端换行不会拆出额外的回复")
    void testErrorReplyStaysOneElement() {
        final Resp unknown = exec("FOO\r\n:42\r\n+OK");
        assertEquals(1, decodeAll(unknown).size());
        assertError("ERR unknown command 'FOO  :42  +OK'", unknown);

        final Resp subcommand = exec("CLIENT", "x\r\n+OK");
        assertEquals(1, decodeAll(subcommand).size());
        assertErrorStartsWith("ERR unknown subcommand 'x  +OK'", subcommand);

        // 连接上的下一条命令得到自己的回复
        assertSame(SimpleString.PONG, exec("PING"));
    }

    private static List<Resp> decodeAll(final Resp reply) {
        final ByteBuf buf = Unpooled.buffer();
        try {
            reply.encode(buf);
            final List<Resp> decoded = new ArrayList<>();
            while (buf.isReadable()) {
                final Resp element = Resp.decode(buf);
                assertNotNull(element);
                decoded.add(element);
            }
            return decoded;
        } finally {
            buf.release();
        }
    }
}
