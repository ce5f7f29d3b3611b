package express.mvp.courier.server;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.serialization.Message;

/**
 * Callback handler for {@link CourierServer} events.
 *
 * <p>Every method has an empty default, so implementations override only what they need.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>For each client connection, callbacks are invoked in this order:
 *
 * <ol>
 *   <li>{@link #onClientConnected(Connection)} - once, on the accept thread, before any message
 *   <li>{@link #onMessageReceived(Connection, Message)} and
 *       {@link #onSocketException(Connection, Throwable)} - on the connection's receive thread
 *   <li>{@link #onClientDisconnected(Connection)} - once, when the connection ends, after the
 *       receive thread has stopped delivering
 * </ol>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks for one connection never run concurrently with each other.
 * {@link #onClientDisconnected} runs on whichever thread ended the session; when a message or
 * exception callback ends its own session, for example through
 * {@link CourierServer#disconnect(Connection)}, the disconnected callback runs nested inside it.
 * Callbacks for different connections run concurrently.
 *
 * <h2>Example Implementation</h2>
 *
 * <pre>{@code
 * CourierServerHandler echo = new CourierServerHandler() {
 *     @Override
 *     public void onMessageReceived(Connection connection, Message message) {
 *         server.send(connection, message);
 *     }
 * };
 * }</pre>
 *
 * <p>Exceptions thrown from any callback are logged and otherwise ignored.
 */
public interface CourierServerHandler {

    /**
     * Called when a client connection is accepted.
     *
     * @param connection the new connection
     */
    default void onClientConnected(Connection connection) {}

    /**
     * Called for each message received from a client.
     *
     * @param connection the source connection
     * @param message the deserialized message
     */
    default void onMessageReceived(Connection connection, Message message) {}

    /**
     * Called when a frame could not be decoded or the connection failed.
     *
     * <p>Unknown type ids and malformed payloads are reported here and the connection keeps
     * receiving. Any other failure ends the connection.
     *
     * @param connection the affected connection
     * @param error the failure
     */
    default void onSocketException(Connection connection, Throwable error) {}

    /**
     * Called once when a client connection ends, whichever side closed it.
     *
     * @param connection the closed connection
     */
    default void onClientDisconnected(Connection connection) {}
}
