package express.mvp.courier.transport;

/**
 * Receives infrastructure failures detected inside a {@link MessageReceiveLoop}.
 *
 * <p>Two kinds of failure arrive here:
 *
 * <ul>
 *   <li>per-frame failures (unknown message type, malformed payload), after which the loop
 *       continues with the next frame
 *   <li>connection failures (I/O errors, corrupt framing), after which the loop exits
 * </ul>
 *
 * <p>Expected shutdown (end of stream, cancellation) is never reported. The embedding application
 * decides the retry, logging and alerting policy.
 */
@FunctionalInterface
public interface SocketExceptionHandler {

    /** Handler that ignores every failure. */
    SocketExceptionHandler IGNORE = (connection, error) -> {};

    /**
     * Called on the loop's thread for each reported failure.
     *
     * @param connection the connection the failure belongs to
     * @param error the failure
     */
    void onSocketException(Connection connection, Throwable error);
}
