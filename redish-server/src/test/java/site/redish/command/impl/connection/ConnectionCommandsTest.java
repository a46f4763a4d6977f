package site.redish.command.impl.connection;

import org.junit.jupiter.api.Test;
import site.redish.command.CommandTestSupport;
import site.redish.protocol.BulkString;
import site.redish.protocol.SimpleString;
import site.redish.server.session.ClientSession;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionCommandsTest extends CommandTestSupport {

    @Test
    void testPing() {
        assertSame(SimpleString.PONG, exec("PING"));
        assertBulk("hello", exec("ping", "hello"));
        assertError("ERR wrong number of arguments for 'ping' command", exec("PING", "a", "b"));
    }

    @Test
    void testEcho() {
        assertBulk("hello world", exec("ECHO", "hello world"));
        assertBulk("", exec("ECHO", ""));
    }

    @Test
    void testClientId() {
        final ClientSession other = newSession();

        assertInteger(session.getClientId(), exec("CLIENT", "ID"));
        assertInteger(other.getClientId(), exec(other, "client", "id"));
        assertNotEquals(session.getClientId(), other.getClientId());
    }

    @Test
    void testClientName() {
        assertNullBulk(exec("CLIENT", "GETNAME"));

        assertOk(exec("CLIENT", "SETNAME", "worker-1"));
        assertBulk("worker-1", exec("CLIENT", "GETNAME"));
        assertEquals("worker-1", session.getName());

        // 空名称清除名称
        assertOk(exec("CLIENT", "SETNAME", ""));
        assertNullBulk(exec("CLIENT", "GETNAME"));
    }

    @Test
    void testClientSetnameRejectsSpaces() {
        assertError("ERR Client names cannot contain spaces, newlines or special characters.",
                exec("CLIENT", "SETNAME", "bad name"));
        assertNull(session.getName());
    }

    @Test
    void testClientList() {
        newSession();
        assertOk(exec("CLIENT", "SETNAME", "me"));

        final String list = ((BulkString) exec("CLIENT", "LIST")).getContent().getString();

        assertEquals(2, list.split("\n").length);
        assertTrue(list.contains("id=" + session.getClientId() + " "));
        assertTrue(list.contains("name=me "));
    }

    @Test
    void testClientErrors() {
        assertError("ERR unknown subcommand 'KILLALL'. Try CLIENT HELP.", exec("CLIENT", "KILLALL"));
        assertError("ERR wrong number of arguments for 'client|setname' command", exec("CLIENT", "SETNAME"));
        assertError("ERR wrong number of arguments for 'client|id' command", exec("CLIENT", "ID", "x"));
    }
}
