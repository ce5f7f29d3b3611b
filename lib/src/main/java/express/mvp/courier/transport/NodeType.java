package express.mvp.courier.transport;

/**
 * Role of the node owning a connection.
 *
 * <p>The node type is a policy classifier for per-connection socket parameters. Request/response
 * roles expect traffic on every connection and apply the configured receive timeout; the
 * streaming and queue roles keep long idle connections and block on reads indefinitely.
 *
 * <table border="1">
 *   <caption>Receive timeout policy</caption>
 *   <tr><th>Node type</th><th>Receive timeout</th></tr>
 *   <tr><td>REQUESTER, RESPONDER</td><td>applied</td></tr>
 *   <tr><td>PUBLISHER, SUBSCRIBER</td><td>none</td></tr>
 *   <tr><td>SERVICE_QUEUE, SERVICE_QUEUE_READER, SERVICE_QUEUE_WRITER</td><td>none</td></tr>
 * </table>
 *
 * @see SocketConfiguration#getReceiveTimeout()
 */
public enum NodeType {
    REQUESTER(true),
    RESPONDER(true),
    PUBLISHER(false),
    SUBSCRIBER(false),
    SERVICE_QUEUE(false),
    SERVICE_QUEUE_READER(false),
    SERVICE_QUEUE_WRITER(false);

    private final boolean receiveTimeout;

    NodeType(boolean receiveTimeout) {
        this.receiveTimeout = receiveTimeout;
    }

    /**
     * Checks if connections of this node type get the configured receive timeout.
     *
     * @return true if reads should time out
     */
    public boolean hasReceiveTimeout() {
        return receiveTimeout;
    }
}
