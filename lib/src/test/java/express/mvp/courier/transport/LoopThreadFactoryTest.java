package express.mvp.courier.transport;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LoopThreadFactory}. */
@DisplayName("LoopThreadFactory")
class LoopThreadFactoryTest {

    @Test
    @DisplayName("Creates numbered daemon threads")
    void createsNumberedDaemonThreads() {
        LoopThreadFactory factory = new LoopThreadFactory("test-loop");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("test-loop-1", first.getName());
        assertEquals("test-loop-2", second.getName());
        assertTrue(first.isDaemon());
        assertEquals(2, factory.getThreadCount());
        assertEquals("test-loop", factory.getNamePrefix());
    }

    @Test
    @DisplayName("Can create non-daemon threads")
    void nonDaemon() {
        Thread thread = new LoopThreadFactory("worker", false).newThread(() -> { });

        assertFalse(thread.isDaemon());
    }

    @Test
    @DisplayName("Shared factories name accept and receive threads apart")
    void sharedFactories_haveDistinctPrefixes() {
        assertEquals("courier-accept", LoopThreadFactory.ACCEPT.getNamePrefix());
        assertEquals("courier-receive", LoopThreadFactory.RECEIVE.getNamePrefix());
    }
}
