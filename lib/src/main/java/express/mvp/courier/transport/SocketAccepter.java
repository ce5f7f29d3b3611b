package express.mvp.courier.transport;

/**
 * Listens on an endpoint and hands each newly established connection to the application.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 *   bind() ──► listening ──► unbind() ──► (loop exited) ──► bind() ...
 * </pre>
 *
 * <p>{@link #bind} returns once the accepter is listening; connections are accepted on a background
 * thread. {@link #unbind(boolean)} stops listening and may be called any number of times. An
 * accepter can be bound again once a previous unbind has let the loop exit.
 *
 * <h2>Ownership</h2>
 *
 * <p>Each accepted {@link Connection} is owned by the application from the moment
 * {@link ClientConnectedHandler#onClientConnected} is invoked. Unbinding never closes connections
 * that were already handed over.
 *
 * @see express.mvp.courier.transport.tcp.NetworkAcceptLoop
 * @see express.mvp.courier.transport.virtual.VirtualAcceptLoop
 */
public interface SocketAccepter extends AutoCloseable {

    /**
     * Starts listening on an endpoint.
     *
     * @param endpoint where to listen; a network endpoint may use port 0 for an ephemeral port
     * @param nodeType policy for per-connection socket options
     * @param socketConfiguration options applied to every accepted connection
     * @param onConnected invoked once per accepted connection on the accept thread
     * @param onDisconnected invoked once when an accepted connection disconnects
     * @throws TransportConfigurationException {@code ALREADY_BOUND} if a previous bind has not fully
     *     stopped, {@code INVALID_TRANSPORT} for an endpoint of the wrong kind
     * @throws TransportException if the endpoint cannot be bound
     */
    void bind(
            Endpoint endpoint,
            NodeType nodeType,
            SocketConfiguration socketConfiguration,
            ClientConnectedHandler onConnected,
            ClientDisconnectedHandler onDisconnected);

    /**
     * Stops listening. A second call is a no-op.
     *
     * @param waitForExit whether to block until the accept loop has exited
     */
    void unbind(boolean waitForExit);

    /** Stops listening and waits for the accept loop to exit. */
    default void unbind() {
        unbind(true);
    }

    /**
     * Returns the endpoint actually bound; for a network endpoint bound with port 0 it carries the
     * assigned port.
     *
     * @return the bound endpoint, or null when not bound
     */
    Endpoint getBoundEndpoint();

    /**
     * Checks whether the accepter is currently listening.
     *
     * @return true while bound
     */
    boolean isBound();

    /** Same as {@link #unbind()}. */
    @Override
    default void close() {
        unbind(true);
    }
}
