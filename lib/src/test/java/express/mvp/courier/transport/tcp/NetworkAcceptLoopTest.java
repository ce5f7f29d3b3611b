package express.mvp.courier.transport.tcp;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportConfigurationException.Reason;
import express.mvp.courier.transport.TransportException;
import express.mvp.courier.transport.lifecycle.LoopState;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Integration tests for {@link NetworkAcceptLoop} and {@link NetworkConnector} over loopback. */
@DisplayName("NetworkAcceptLoop")
@Timeout(15)
class NetworkAcceptLoopTest {

    private static final Endpoint ANY_PORT = Endpoint.network("127.0.0.1", 0);

    private NetworkAcceptLoop accepter;
    private BlockingQueue<Connection> connected;
    private BlockingQueue<Connection> disconnected;
    private List<Connection> opened;

    @BeforeEach
    void setUp() {
        accepter = new NetworkAcceptLoop();
        connected = new LinkedBlockingQueue<>();
        disconnected = new LinkedBlockingQueue<>();
        opened = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        accepter.unbind(true);
        opened.forEach(Connection::close);
    }

    private void bind(NodeType nodeType, SocketConfiguration configuration) {
        accepter.bind(ANY_PORT, nodeType, configuration,
                (connection, config) -> {
                    opened.add(connection);
                    connected.add(connection);
                },
                disconnected::add);
    }

    @Test
    @DisplayName("Accepted socket carries the configured options and reports one disconnect")
    void acceptedSocket_isConfigured() throws Exception {
        SocketConfiguration configuration = SocketConfiguration.builder()
                .sendBufferSize(16384)
                .receiveBufferSize(16384)
                .build();
        bind(NodeType.SUBSCRIBER, configuration);
        Endpoint bound = accepter.getBoundEndpoint();
        assertNotEquals(0, bound.getPort());

        Connection client = new NetworkConnector().connect(bound, configuration);
        Connection accepted = connected.poll(5, TimeUnit.SECONDS);
        assertNotNull(accepted);

        NetworkConnection server = assertInstanceOf(NetworkConnection.class, accepted);
        assertTrue(server.isNoDelay());
        assertEquals(16384, server.getSendBufferSize());
        assertEquals(16384, server.getReceiveBufferSize());
        assertEquals(0, server.getReceiveTimeoutMillis());
        assertEquals(bound, server.getEndpoint());

        client.close();
        assertEquals(-1, server.read(new byte[1], 0, 1));

        assertSame(server, disconnected.poll(5, TimeUnit.SECONDS));
        server.close();
        assertNull(disconnected.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("Request/reply node types keep the receive timeout")
    void requestReplyNode_keepsReceiveTimeout() throws Exception {
        SocketConfiguration configuration = SocketConfiguration.builder()
                .receiveTimeout(Duration.ofMillis(1500))
                .build();
        bind(NodeType.RESPONDER, configuration);

        try (Connection client = new NetworkConnector().connect(accepter.getBoundEndpoint())) {
            NetworkConnection server = (NetworkConnection) connected.poll(5, TimeUnit.SECONDS);
            assertNotNull(server);
            assertEquals(1500, server.getReceiveTimeoutMillis());
            assertTrue(client.isConnected());
        }
    }

    @Test
    @DisplayName("Bytes flow both ways")
    void bytesFlowBothWays() throws Exception {
        bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);

        try (Connection client = new NetworkConnector().connect(accepter.getBoundEndpoint())) {
            Connection server = connected.poll(5, TimeUnit.SECONDS);
            assertNotNull(server);

            client.write(new byte[] {1, 2, 3});
            byte[] buffer = new byte[3];
            readFully(server, buffer);
            assertArrayEquals(new byte[] {1, 2, 3}, buffer);

            server.write(new byte[] {4});
            readFully(client, new byte[1]);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Second bind fails with ALREADY_BOUND")
        void secondBind_throws() {
            bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);

            TransportConfigurationException e = assertThrows(TransportConfigurationException.class,
                    () -> bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT));
            assertEquals(Reason.ALREADY_BOUND, e.getReason());
        }

        @Test
        @DisplayName("Virtual endpoint is rejected with INVALID_TRANSPORT")
        void virtualEndpoint_throws() {
            TransportConfigurationException e = assertThrows(TransportConfigurationException.class,
                    () -> accepter.bind(Endpoint.virtual("nope"), NodeType.RESPONDER,
                            SocketConfiguration.DEFAULT, (c, s) -> { }, c -> { }));
            assertEquals(Reason.INVALID_TRANSPORT, e.getReason());
        }

        @Test
        @DisplayName("Unbind stops accepting and repeated unbind is a no-op")
        void unbind_stopsAccepting() {
            bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);
            Endpoint bound = accepter.getBoundEndpoint();

            accepter.unbind(true);
            accepter.unbind(true);

            assertEquals(LoopState.IDLE, accepter.getState());
            assertFalse(accepter.isBound());
            SocketConfiguration quick = SocketConfiguration.builder()
                    .connectTimeout(Duration.ofSeconds(2))
                    .build();
            assertThrows(TransportException.class, () -> new NetworkConnector().connect(bound, quick));
        }

        @Test
        @DisplayName("Accepter can be bound again after unbind")
        void rebind_afterUnbind() throws Exception {
            bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);
            accepter.unbind(true);

            bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);

            try (Connection client = new NetworkConnector().connect(accepter.getBoundEndpoint())) {
                assertNotNull(connected.poll(5, TimeUnit.SECONDS));
                assertTrue(client.isConnected());
            }
        }

        @Test
        @DisplayName("Binding a port in use fails and leaves the accepter idle")
        void portInUse_throws() {
            bind(NodeType.RESPONDER, SocketConfiguration.DEFAULT);
            NetworkAcceptLoop other = new NetworkAcceptLoop();

            assertThrows(TransportException.class, () -> other.bind(accepter.getBoundEndpoint(),
                    NodeType.RESPONDER, SocketConfiguration.DEFAULT, (c, s) -> { }, c -> { }));
            assertEquals(LoopState.IDLE, other.getState());
        }
    }

    private static void readFully(Connection connection, byte[] buffer) throws IOException {
        int filled = 0;
        while (filled < buffer.length) {
            int read = connection.read(buffer, filled, buffer.length - filled);
            assertTrue(read > 0, "unexpected end of stream");
            filled += read;
        }
    }
}
