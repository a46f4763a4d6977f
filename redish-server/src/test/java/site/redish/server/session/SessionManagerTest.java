package site.redish.server.session;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    private final SessionManager manager = new SessionManager();

    @Test
    void testCreateAssignsIncreasingClientIds() {
        final ClientSession first = manager.create(null);
        final ClientSession second = manager.create(null);

        assertEquals(1, first.getClientId());
        assertEquals(2, second.getClientId());
        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, manager.size());
        assertSame(first, manager.get(first.getId()));
    }

    @Test
    void testRemove() {
        final ClientSession session = manager.create(null);
        manager.remove(session);

        assertNull(manager.get(session.getId()));
        assertEquals(0, manager.size());
        assertTrue(manager.getSessions().isEmpty());
    }

    @Test
    void testCloseAll() {
        final EmbeddedChannel channel = new EmbeddedChannel();
        final ClientSession session = manager.create(channel);
        session.transitionTo(SessionState.ESTABLISHED);

        manager.closeAll();

        assertFalse(channel.isOpen());
        assertEquals(SessionState.CLOSING, session.getState());
    }
}
