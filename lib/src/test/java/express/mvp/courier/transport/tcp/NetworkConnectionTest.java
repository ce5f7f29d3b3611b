package express.mvp.courier.transport.tcp;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.OperationCancelledException;
import express.mvp.courier.transport.SocketConfiguration;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link NetworkConnection}. */
@DisplayName("NetworkConnection")
@Timeout(15)
class NetworkConnectionTest {

    private ServerSocketChannel listener;
    private SocketChannel clientChannel;
    private SocketChannel serverChannel;
    private Endpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        listener = ServerSocketChannel.open();
        listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        int port = ((InetSocketAddress) listener.getLocalAddress()).getPort();
        endpoint = Endpoint.network("127.0.0.1", port);
        clientChannel = SocketChannel.open(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
        serverChannel = listener.accept();
    }

    @AfterEach
    void tearDown() throws IOException {
        clientChannel.close();
        serverChannel.close();
        listener.close();
    }

    private NetworkConnection open(SocketChannel channel, NodeType nodeType, SocketConfiguration config)
            throws IOException {
        return NetworkConnection.open(channel, endpoint, nodeType, config);
    }

    @Test
    @DisplayName("Receive timeout fails a read with SocketTimeoutException")
    void receiveTimeout_failsRead() throws IOException {
        SocketConfiguration config = SocketConfiguration.builder()
                .receiveTimeout(Duration.ofMillis(100))
                .build();
        NetworkConnection connection = open(serverChannel, NodeType.REQUESTER, config);

        assertThrows(SocketTimeoutException.class, () -> connection.read(new byte[1], 0, 1));
        assertTrue(connection.isConnected());
        connection.close();
    }

    @Test
    @DisplayName("Interrupting a blocked read cancels it and keeps the socket open")
    void interruptedRead_isCancelled() throws Exception {
        NetworkConnection server = open(serverChannel, NodeType.SUBSCRIBER, SocketConfiguration.DEFAULT);
        NetworkConnection client = open(clientChannel, NodeType.PUBLISHER, SocketConfiguration.DEFAULT);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                server.read(new byte[1], 0, 1);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        reader.start();
        Thread.sleep(100);

        reader.interrupt();
        reader.join();

        assertInstanceOf(OperationCancelledException.class, failure.get());
        assertTrue(server.isConnected());
        client.write(new byte[] {5});
        byte[] buffer = new byte[1];
        assertEquals(1, server.read(buffer, 0, 1));
        assertEquals(5, buffer[0]);
        server.close();
        client.close();
    }

    @Test
    @DisplayName("shutdownInput ends a blocked read with end of stream")
    void shutdownInput_endsRead() throws Exception {
        NetworkConnection server = open(serverChannel, NodeType.SUBSCRIBER, SocketConfiguration.DEFAULT);
        AtomicReference<Integer> result = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                result.set(server.read(new byte[1], 0, 1));
            } catch (IOException e) {
                result.set(-2);
            }
        });
        reader.start();
        Thread.sleep(100);

        server.shutdownInput();
        reader.join();

        assertEquals(-1, result.get());
        server.close();
    }

    @Test
    @DisplayName("close wakes a blocked read")
    void close_wakesBlockedRead() throws Exception {
        NetworkConnection server = open(serverChannel, NodeType.SUBSCRIBER, SocketConfiguration.DEFAULT);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                server.read(new byte[1], 0, 1);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        reader.start();
        Thread.sleep(100);

        server.close();
        reader.join();

        assertInstanceOf(ConnectionClosedException.class, failure.get());
        assertFalse(server.isConnected());
    }

    @Test
    @DisplayName("Write after close fails")
    void writeAfterClose_throws() throws IOException {
        NetworkConnection client = open(clientChannel, NodeType.REQUESTER, SocketConfiguration.DEFAULT);
        client.close();

        assertThrows(ConnectionClosedException.class, () -> client.write(new byte[] {1}));
    }

    @Test
    @DisplayName("Large writes complete even when the peer reads slowly")
    void largeWrite_completes() throws Exception {
        SocketConfiguration small = SocketConfiguration.builder()
                .sendBufferSize(4096)
                .receiveBufferSize(4096)
                .build();
        NetworkConnection server = open(serverChannel, NodeType.SUBSCRIBER, small);
        NetworkConnection client = open(clientChannel, NodeType.PUBLISHER, small);
        byte[] data = new byte[1024 * 1024];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread writer = new Thread(() -> {
            try {
                client.write(data);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        writer.start();

        byte[] received = new byte[data.length];
        int filled = 0;
        while (filled < received.length) {
            filled += server.read(received, filled, Math.min(8192, received.length - filled));
        }
        writer.join();

        assertNull(failure.get());
        assertArrayEquals(data, received);
        server.close();
        client.close();
    }
}
