package express.mvp.courier.server;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.LoopThreadFactory;
import express.mvp.courier.transport.MessageReceiveLoop;
import express.mvp.courier.transport.SocketAccepter;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportFactory;
import express.mvp.courier.transport.framing.FrameCodec;
import express.mvp.courier.transport.lifecycle.LoopState;
import express.mvp.courier.transport.serialization.Message;
import express.mvp.courier.transport.serialization.MessageSender;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * High-level server API for Courier.
 *
 * <p>The server listens on every configured endpoint, gives each accepted connection its own
 * {@link MessageReceiveLoop} and routes all events to one {@link CourierServerHandler}.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                       CourierServer                         │
 * ├─────────────────────────────────────────────────────────────┤
 * │  ┌──────────────────┐   ┌──────────────────┐                │
 * │  │ NetworkAcceptLoop│   │ VirtualAcceptLoop│   one per      │
 * │  │  tcp://host:port │   │  inproc://name   │   endpoint     │
 * │  └────────┬─────────┘   └────────┬─────────┘                │
 * │           └──────────┬───────────┘                          │
 * │                      ▼                                      │
 * │   ┌─────────────────────────────────────────────────────┐   │
 * │   │  Sessions: Connection ──► MessageReceiveLoop         │   │
 * │   │  (one receive thread per connection)                 │   │
 * │   └─────────────────────────────────────────────────────┘   │
 * │                      │                                      │
 * │                      ▼                                      │
 * │   ┌─────────────────────────────────────────────────────┐   │
 * │   │         CourierServerHandler (callbacks)            │   │
 * │   └─────────────────────────────────────────────────────┘   │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CourierServerConfig config = CourierServerConfig.builder()
 *     .endpoint(Endpoint.network("0.0.0.0", 7400))
 *     .serializationRegistry(registry)
 *     .build();
 *
 * try (CourierServer server = new CourierServer(config, handler)) {
 *     server.start();
 *     // Server runs until closed
 * }
 * }</pre>
 *
 * <h2>Connection Lifecycle</h2>
 *
 * <p>A session ends when the client closes, when {@link #disconnect(Connection)} is called, or when
 * its receive loop exits on its own (an I/O error, a receive timeout or an invalid frame header).
 * Either way the server closes the receive loop and the connection and notifies the handler exactly
 * once. The disconnected callback follows the session's last message callback; when the session
 * ends from inside one of its own callbacks, it runs nested in that callback.
 *
 * @see CourierServerConfig
 * @see CourierServerHandler
 */
public class CourierServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(CourierServer.class.getName());

    private final CourierServerConfig config;
    private final CourierServerHandler handler;
    private final FrameCodec codec;
    private final MessageSender sender;

    private final List<SocketAccepter> accepters = new CopyOnWriteArrayList<>();
    private final Map<Connection, MessageReceiveLoop> sessions = new ConcurrentHashMap<>();

    /** Flag indicating whether the server is running. */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Creates a new server.
     *
     * @param config server configuration
     * @param handler event handler
     */
    public CourierServer(CourierServerConfig config, CourierServerHandler handler) {
        this.config = config;
        this.handler = handler;
        this.codec = new FrameCodec(config.getMaxPayloadSize());
        this.sender = new MessageSender(config.getSerializationRegistry(), codec);
    }

    /**
     * Binds every configured endpoint.
     *
     * <p>When this returns, all endpoints are listening. If any bind fails, the endpoints bound so
     * far are released and the failure is rethrown. Calling {@code start()} on a running server
     * does nothing.
     *
     * @throws express.mvp.courier.transport.TransportException if an endpoint cannot be bound
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            for (Endpoint endpoint : config.getEndpoints()) {
                SocketAccepter accepter = TransportFactory.createAccepter(
                        endpoint.getTransportKind(), config.getVirtualRegistry());
                accepter.bind(endpoint, config.getNodeType(), config.getSocketConfiguration(),
                        this::onConnected, this::onDisconnected);
                accepters.add(accepter);
                LOGGER.fine(() -> "Listening on " + accepter.getBoundEndpoint());
            }
        } catch (RuntimeException e) {
            stop();
            throw e;
        }
    }

    /**
     * Stops listening and ends every connection.
     *
     * <p>Accepters are unbound first, so no new connection arrives while existing ones are torn
     * down. When this returns no handler callback is running or will run for message delivery.
     */
    public void stop() {
        running.set(false);
        for (SocketAccepter accepter : accepters) {
            accepter.unbind(true);
        }
        accepters.clear();

        for (Connection connection : new ArrayList<>(sessions.keySet())) {
            endSession(connection);
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Serializes a message and writes it to a client.
     *
     * @param connection a connection of this server
     * @param message the message
     * @throws IOException if the write fails
     * @throws express.mvp.courier.transport.serialization.SerializationException if the message
     *     cannot be serialized
     */
    public void send(Connection connection, Message message) throws IOException {
        sender.send(connection, message);
    }

    /**
     * Closes a client connection. The handler's disconnected callback follows.
     *
     * @param connection the connection
     */
    public void disconnect(Connection connection) {
        connection.close();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    public List<Connection> getConnections() {
        return new ArrayList<>(sessions.keySet());
    }

    /**
     * Returns the endpoints actually listening, with assigned ports for port-0 endpoints.
     *
     * @return the bound endpoints
     */
    public List<Endpoint> getBoundEndpoints() {
        List<Endpoint> bound = new ArrayList<>();
        for (SocketAccepter accepter : accepters) {
            Endpoint endpoint = accepter.getBoundEndpoint();
            if (endpoint != null) {
                bound.add(endpoint);
            }
        }
        return bound;
    }

    public CourierServerConfig getConfig() {
        return config;
    }

    private void onConnected(Connection connection, SocketConfiguration socketConfiguration) {
        if (!running.get()) {
            connection.close();
            return;
        }
        MessageReceiveLoop loop = new MessageReceiveLoop(
                connection,
                config.getSerializationRegistry(),
                handler::onMessageReceived,
                handler::onSocketException,
                codec,
                LoopThreadFactory.RECEIVE);
        // Covers loop exits the connection never reports as a disconnect
        loop.addStateListener((previous, current) -> {
            if (current == LoopState.IDLE) {
                endSession(connection);
            }
        });
        sessions.put(connection, loop);

        try {
            handler.onClientConnected(connection);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "onClientConnected failed for " + connection, e);
        }
        loop.start();
    }

    private void onDisconnected(Connection connection) {
        endSession(connection);
    }

    private void endSession(Connection connection) {
        MessageReceiveLoop loop = sessions.remove(connection);
        if (loop == null) {
            return;
        }
        loop.close();
        connection.close();
        // No-op on the loop thread itself
        loop.stop(true);
        try {
            handler.onClientDisconnected(connection);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "onClientDisconnected failed for " + connection, e);
        }
    }

    @Override
    public String toString() {
        return "CourierServer[endpoints=" + config.getEndpoints()
                + ", connections=" + sessions.size()
                + ", running=" + running.get() + "]";
    }
}
