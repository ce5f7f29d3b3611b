package express.mvp.courier.transport.virtual;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportConfigurationException.Reason;
import express.mvp.courier.transport.error.RetryPolicy;
import express.mvp.courier.transport.lifecycle.LoopState;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link VirtualAcceptLoop}. */
@DisplayName("VirtualAcceptLoop")
@Timeout(10)
class VirtualAcceptLoopTest {

    private static final Endpoint ENDPOINT = Endpoint.virtual("accept-test");

    private VirtualTransportRegistry registry;
    private VirtualAcceptLoop accepter;
    private BlockingQueue<Connection> connected;
    private BlockingQueue<Connection> disconnected;

    @BeforeEach
    void setUp() {
        registry = new VirtualTransportRegistry();
        accepter = new VirtualAcceptLoop(registry);
        connected = new LinkedBlockingQueue<>();
        disconnected = new LinkedBlockingQueue<>();
    }

    @AfterEach
    void tearDown() {
        accepter.unbind(true);
    }

    private void bind() {
        accepter.bind(ENDPOINT, NodeType.RESPONDER, SocketConfiguration.DEFAULT,
                (connection, configuration) -> connected.add(connection), disconnected::add);
    }

    @Nested
    @DisplayName("Binding")
    class BindingTests {

        @Test
        @DisplayName("Peers can connect as soon as bind returns")
        void bind_isSynchronous() throws Exception {
            bind();

            assertTrue(accepter.isBound());
            assertEquals(ENDPOINT, accepter.getBoundEndpoint());
            assertEquals(LoopState.RUNNING, accepter.getState());

            Connection client = registry.connect(ENDPOINT);
            Connection server = connected.poll(5, TimeUnit.SECONDS);
            assertNotNull(server);

            client.write(new byte[] {1});
            assertEquals(1, server.read(new byte[1], 0, 1));
        }

        @Test
        @DisplayName("Second bind while bound fails with ALREADY_BOUND")
        void secondBind_throws() {
            bind();

            TransportConfigurationException e =
                    assertThrows(TransportConfigurationException.class, () -> bind());
            assertEquals(Reason.ALREADY_BOUND, e.getReason());
        }

        @Test
        @DisplayName("Network endpoint is rejected with INVALID_TRANSPORT")
        void networkEndpoint_throws() {
            TransportConfigurationException e = assertThrows(TransportConfigurationException.class,
                    () -> accepter.bind(Endpoint.network("localhost", 0), NodeType.RESPONDER,
                            SocketConfiguration.DEFAULT, (c, s) -> { }, c -> { }));
            assertEquals(Reason.INVALID_TRANSPORT, e.getReason());
            assertEquals(LoopState.IDLE, accepter.getState());
        }

        @Test
        @DisplayName("Name taken by another accepter fails and leaves this one idle")
        void nameInUse_throws() {
            registry.registerAccepter(ENDPOINT);

            TransportConfigurationException e =
                    assertThrows(TransportConfigurationException.class, () -> bind());
            assertEquals(Reason.ALREADY_REGISTERED, e.getReason());
            assertEquals(LoopState.IDLE, accepter.getState());
            assertFalse(accepter.isBound());
        }
    }

    @Nested
    @DisplayName("Unbinding")
    class UnbindingTests {

        @Test
        @DisplayName("unbind(true) returns with the loop idle and the name released")
        void unbind_releasesName() {
            bind();

            accepter.unbind(true);

            assertEquals(LoopState.IDLE, accepter.getState());
            assertFalse(accepter.isBound());
            assertNull(accepter.getBoundEndpoint());
            assertFalse(registry.isRegistered(ENDPOINT));
            assertThrows(TransportConfigurationException.class, () -> registry.connect(ENDPOINT));
        }

        @Test
        @DisplayName("Repeated unbind is a no-op")
        void doubleUnbind_isNoOp() {
            bind();

            accepter.unbind(true);
            accepter.unbind(true);
            accepter.unbind(false);

            assertEquals(LoopState.IDLE, accepter.getState());
        }

        @Test
        @DisplayName("Unbind without bind is a no-op")
        void unbindWithoutBind_isNoOp() {
            accepter.unbind();

            assertEquals(LoopState.IDLE, accepter.getState());
        }

        @Test
        @DisplayName("Accepter can be bound again after unbind")
        void rebind_afterUnbind() throws Exception {
            bind();
            accepter.unbind(true);

            bind();
            registry.connect(ENDPOINT);

            assertNotNull(connected.poll(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Close delegates to a waiting unbind")
        void close_unbinds() {
            bind();

            accepter.close();

            assertEquals(LoopState.IDLE, accepter.getState());
            assertFalse(registry.isRegistered(ENDPOINT));
        }
    }

    @Nested
    @DisplayName("Handlers")
    class HandlerTests {

        @Test
        @DisplayName("Client close reaches the disconnected handler once")
        void clientClose_notifiesOnce() throws Exception {
            bind();
            Connection client = registry.connect(ENDPOINT);
            Connection server = connected.poll(5, TimeUnit.SECONDS);
            assertNotNull(server);

            client.close();
            assertEquals(-1, server.read(new byte[1], 0, 1));
            server.close();

            assertSame(server, disconnected.poll(5, TimeUnit.SECONDS));
            assertNull(disconnected.poll(100, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("A failing connected handler does not stop the loop")
        void failingHandler_isIsolated() throws Exception {
            CountDownLatch calls = new CountDownLatch(2);
            accepter.bind(ENDPOINT, NodeType.RESPONDER, SocketConfiguration.DEFAULT,
                    (connection, configuration) -> {
                        calls.countDown();
                        throw new IllegalStateException("handler failure");
                    },
                    c -> { });

            registry.connect(ENDPOINT);
            registry.connect(ENDPOINT);

            assertTrue(calls.await(5, TimeUnit.SECONDS));
            assertEquals(LoopState.RUNNING, accepter.getState());
        }

        @Test
        @DisplayName("Handler receives the socket configuration given to bind")
        void handler_receivesConfiguration() throws IOException, InterruptedException {
            SocketConfiguration configuration =
                    SocketConfiguration.builder().sendBufferSize(4096).build();
            BlockingQueue<SocketConfiguration> seen = new LinkedBlockingQueue<>();
            accepter.bind(ENDPOINT, NodeType.PUBLISHER, configuration,
                    (connection, config) -> seen.add(config), c -> { });

            registry.connect(ENDPOINT);

            assertSame(configuration, seen.poll(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("Unbind closes connections that were queued but not yet accepted")
    void unbind_closesPendingConnections() {
        CountDownLatch gate = new CountDownLatch(1);
        ThreadFactory gated = runnable -> new Thread(() -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            runnable.run();
        });
        VirtualAcceptLoop held = new VirtualAcceptLoop(registry, gated, RetryPolicy.acceptDefault());
        held.bind(ENDPOINT, NodeType.RESPONDER, SocketConfiguration.DEFAULT,
                (connection, configuration) -> connected.add(connection), disconnected::add);
        VirtualConnection client = registry.connect(ENDPOINT);

        held.unbind(true);
        gate.countDown();

        assertThrows(ConnectionClosedException.class, () -> client.write(new byte[] {1}));
        assertTrue(connected.isEmpty());
    }
}
