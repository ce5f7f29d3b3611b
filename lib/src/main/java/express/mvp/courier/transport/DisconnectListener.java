package express.mvp.courier.transport;

/**
 * Receives the one-shot disconnected notification of a {@link Connection}.
 *
 * @see Connection#addDisconnectListener(DisconnectListener)
 */
@FunctionalInterface
public interface DisconnectListener {

    /**
     * Called once when the connection disconnects.
     *
     * @param connection the connection that disconnected
     */
    void onDisconnected(Connection connection);
}
