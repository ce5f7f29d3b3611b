package express.mvp.courier.transport;

/**
 * Called by an accepter when a connection it accepted disconnects.
 *
 * <p>Invoked at most once per connection, on whichever thread observed the disconnect.
 */
@FunctionalInterface
public interface ClientDisconnectedHandler {

    /**
     * Called once when an accepted connection disconnects.
     *
     * @param connection the connection
     */
    void onClientDisconnected(Connection connection);
}
