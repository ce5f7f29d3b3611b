package express.mvp.courier.transport;

/**
 * Opens outgoing connections to an endpoint.
 *
 * @see express.mvp.courier.transport.tcp.NetworkConnector
 * @see express.mvp.courier.transport.virtual.VirtualConnector
 */
public interface SocketConnector {

    /**
     * Connects to an endpoint.
     *
     * @param endpoint the target
     * @param socketConfiguration connect timeout and options for the new connection
     * @return the connected connection, owned by the caller
     * @throws TransportConfigurationException {@code INVALID_TRANSPORT} for an endpoint of the
     *     wrong kind, {@code NOT_LISTENING} when nobody listens on a virtual endpoint
     * @throws TransportException if the connection cannot be established
     */
    Connection connect(Endpoint endpoint, SocketConfiguration socketConfiguration);

    /**
     * Connects with the default socket configuration.
     *
     * @param endpoint the target
     * @return the connected connection
     */
    default Connection connect(Endpoint endpoint) {
        return connect(endpoint, SocketConfiguration.DEFAULT);
    }
}
