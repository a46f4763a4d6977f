package site.redish;

import org.junit.jupiter.api.Test;
import site.redish.server.config.RedisServerConfig;

import static org.junit.jupiter.api.Assertions.*;

class RedisServerLauncherTest {

    @Test
    void testNoArgumentsUsesDefaults() {
        final RedisServerConfig config = RedisServerLauncher.parseArguments(new String[0]);

        assertEquals(6379, config.getPort());
        assertEquals(16, config.getDatabaseCount());
    }

    @Test
    void testAllOptions() {
        final RedisServerConfig config = RedisServerLauncher.parseArguments(new String[]{
                "--host", "0.0.0.0",
                "--port", "7000",
                "--databases", "4",
                "--repl-backlog-size", "2048",
                "--server-id", "node-a"});

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals(4, config.getDatabaseCount());
        assertEquals(2048, config.getReplicationBacklogSize());
        assertEquals("node-a", config.getServerId());
    }

    @Test
    void testOutOfRangeValueParsesButFailsValidation() {
        final RedisServerConfig config = RedisServerLauncher.parseArguments(new String[]{"--port", "70000"});
        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> RedisServerLauncher.parseArguments(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class,
                () -> RedisServerLauncher.parseArguments(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class,
                () -> RedisServerLauncher.parseArguments(new String[]{"--verbose", "yes"}));
    }
}
