package express.mvp.courier.transport;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.courier.transport.error.RetryPolicy;
import express.mvp.courier.transport.lifecycle.LoopState;
import express.mvp.courier.transport.virtual.VirtualConnection;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for the accept loop behaviour shared by both transports. */
@DisplayName("AbstractAcceptLoop")
@Timeout(10)
class AbstractAcceptLoopTest {

    private static final Endpoint ENDPOINT = Endpoint.virtual("scripted-accept");

    private BlockingQueue<Connection> connected;
    private ScriptedAcceptLoop loop;

    @BeforeEach
    void setUp() {
        connected = new LinkedBlockingQueue<>();
    }

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.unbind(true);
        }
    }

    private void bind(RetryPolicy policy, Object... outcomes) {
        loop = new ScriptedAcceptLoop(policy);
        for (Object outcome : outcomes) {
            loop.outcomes.add(outcome);
        }
        loop.bind(ENDPOINT, NodeType.RESPONDER, SocketConfiguration.DEFAULT,
                (connection, configuration) -> connected.add(connection),
                connection -> { });
    }

    private static Connection newConnection() {
        return VirtualConnection.createPair(ENDPOINT).accepterEnd();
    }

    private static IOException transientFailure() {
        return new IOException("Too many open files");
    }

    private static long gapMillis(List<Long> times, int index) {
        return TimeUnit.NANOSECONDS.toMillis(times.get(index) - times.get(index - 1));
    }

    @Nested
    @DisplayName("Transient accept failures")
    class RetryTests {

        @Test
        @DisplayName("Failures are retried and the next connection is still handed off")
        void failuresAreRetried() throws Exception {
            Connection connection = newConnection();
            bind(RetryPolicy.exponentialBackoff(Duration.ofMillis(20), Duration.ofSeconds(1)),
                    transientFailure(), transientFailure(), transientFailure(), connection);

            assertSame(connection, connected.poll(5, TimeUnit.SECONDS));
            assertTrue(loop.isBound());
            assertEquals(LoopState.RUNNING, loop.getState());

            List<Long> attempts = loop.attemptTimes;
            assertTrue(attempts.size() >= 4, "attempts " + attempts.size());
            assertTrue(gapMillis(attempts, 1) >= 15, "first retry " + gapMillis(attempts, 1));
            assertTrue(gapMillis(attempts, 2) >= 35, "second retry " + gapMillis(attempts, 2));
            assertTrue(gapMillis(attempts, 3) >= 75, "third retry " + gapMillis(attempts, 3));
        }

        @Test
        @DisplayName("A successful accept resets the backoff")
        void successResetsBackoff() throws Exception {
            Connection first = newConnection();
            Connection second = newConnection();
            // Without a reset the sixth failure would wait 640ms
            bind(RetryPolicy.exponentialBackoff(Duration.ofMillis(20), Duration.ofSeconds(2)),
                    transientFailure(), transientFailure(), transientFailure(),
                    transientFailure(), transientFailure(), first,
                    transientFailure(), second);

            assertSame(first, connected.poll(5, TimeUnit.SECONDS));
            assertSame(second, connected.poll(5, TimeUnit.SECONDS));

            List<Long> attempts = loop.attemptTimes;
            long afterReset = gapMillis(attempts, 7);
            assertTrue(afterReset >= 15 && afterReset < 300, "retry after success " + afterReset);
        }

        @Test
        @DisplayName("unbind() during a backoff pause returns promptly")
        void unbindDuringBackoff_returnsPromptly() throws Exception {
            bind(RetryPolicy.exponentialBackoff(Duration.ofSeconds(30), Duration.ofSeconds(30)),
                    transientFailure());
            while (loop.attemptTimes.isEmpty()) {
                Thread.sleep(5);
            }
            Thread.sleep(50);

            long start = System.nanoTime();
            loop.unbind(true);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsed < 2000, "unbind took " + elapsed + "ms");
            assertFalse(loop.isBound());
            assertEquals(LoopState.IDLE, loop.getState());
            assertEquals(1, loop.attemptTimes.size());
            assertEquals(1, loop.listenersClosed.get());
        }
    }

    @Nested
    @DisplayName("Bind failures")
    class BindFailureTests {

        @Test
        @DisplayName("A failure resolving the bound endpoint releases the listener")
        void boundEndpointFailure_releasesListener() {
            loop = new ScriptedAcceptLoop(RetryPolicy.acceptDefault());
            loop.failBoundEndpoint = true;

            assertThrows(TransportException.class, () -> loop.bind(ENDPOINT, NodeType.RESPONDER,
                    SocketConfiguration.DEFAULT, (connection, configuration) -> { }, connection -> { }));

            assertEquals(1, loop.listenersClosed.get());
            assertEquals(LoopState.IDLE, loop.getState());
            assertFalse(loop.isBound());
        }

        @Test
        @DisplayName("The accepter can be bound again after a failed bind")
        void failedBind_allowsRebind() throws Exception {
            loop = new ScriptedAcceptLoop(RetryPolicy.acceptDefault());
            loop.failBoundEndpoint = true;
            assertThrows(TransportException.class, () -> loop.bind(ENDPOINT, NodeType.RESPONDER,
                    SocketConfiguration.DEFAULT, (connection, configuration) -> { }, connection -> { }));

            loop.failBoundEndpoint = false;
            Connection connection = newConnection();
            loop.outcomes.add(connection);
            loop.bind(ENDPOINT, NodeType.RESPONDER, SocketConfiguration.DEFAULT,
                    (accepted, configuration) -> connected.add(accepted), accepted -> { });

            assertTrue(loop.isBound());
            assertSame(connection, connected.poll(5, TimeUnit.SECONDS));
        }
    }

    /** Accept loop that replays queued outcomes: a connection is accepted, an exception thrown. */
    private static final class ScriptedAcceptLoop extends AbstractAcceptLoop<BlockingQueue<Object>> {
        final BlockingQueue<Object> outcomes = new LinkedBlockingQueue<>();
        final List<Long> attemptTimes = new CopyOnWriteArrayList<>();
        final AtomicInteger listenersClosed = new AtomicInteger();
        volatile boolean failBoundEndpoint;

        ScriptedAcceptLoop(RetryPolicy retryPolicy) {
            super("scripted-accept", LoopThreadFactory.ACCEPT, retryPolicy);
        }

        @Override
        protected void checkEndpoint(Endpoint endpoint) {
            TransportConfigurationException.requireKind(endpoint, TransportKind.VIRTUAL);
        }

        @Override
        protected BlockingQueue<Object> openListener(Endpoint endpoint) {
            return outcomes;
        }

        @Override
        protected Endpoint boundEndpoint(BlockingQueue<Object> listener, Endpoint requested) {
            if (failBoundEndpoint) {
                throw new TransportException("Failed to read local address of " + requested);
            }
            return requested;
        }

        @Override
        protected Connection accept(
                BlockingQueue<Object> listener,
                Endpoint boundEndpoint,
                NodeType nodeType,
                SocketConfiguration socketConfiguration)
                throws IOException {
            Object outcome;
            try {
                outcome = listener.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Accept cancelled on " + boundEndpoint);
            }
            attemptTimes.add(System.nanoTime());
            if (outcome instanceof IOException) {
                throw (IOException) outcome;
            }
            return (Connection) outcome;
        }

        @Override
        protected void closeListener(BlockingQueue<Object> listener, Endpoint boundEndpoint) {
            listenersClosed.incrementAndGet();
        }
    }
}
