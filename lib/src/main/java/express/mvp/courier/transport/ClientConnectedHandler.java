package express.mvp.courier.transport;

/**
 * Called by an accepter for every newly established connection.
 *
 * <p>Ownership of the connection passes to the handler. The accepter isolates anything the handler
 * throws: the error is logged and the accept loop keeps running.
 *
 * @see SocketAccepter#bind
 */
@FunctionalInterface
public interface ClientConnectedHandler {

    /**
     * Called once per accepted connection, on the accept loop's thread.
     *
     * @param connection the new connection
     * @param socketConfiguration the configuration that was applied to it
     */
    void onClientConnected(Connection connection, SocketConfiguration socketConfiguration);
}
