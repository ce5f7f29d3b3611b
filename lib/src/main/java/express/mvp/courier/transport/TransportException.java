package express.mvp.courier.transport;

/**
 * Unchecked exception thrown when transport operations fail.
 *
 * <p>This exception wraps bind and connect failures, serialization errors and configuration
 * mistakes. It extends {@link RuntimeException} to avoid cluttering method signatures with checked
 * exceptions. Conditions that belong to a byte stream (end of stream, cancellation, socket errors)
 * are reported as {@link java.io.IOException}s by {@link Connection} instead.
 *
 * <h2>Common Causes</h2>
 *
 * <ul>
 *   <li>Bind failures (address in use, permission denied)
 *   <li>Connect failures (refused, timeout, unknown host)
 *   <li>Unknown message types or malformed payloads
 *   <li>Invalid lifecycle use (binding twice, connecting to an endpoint nobody listens on)
 * </ul>
 *
 * @see TransportConfigurationException
 * @see express.mvp.courier.transport.serialization.SerializationException
 */
public class TransportException extends RuntimeException {

    /**
     * Constructs a new transport exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new transport exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new transport exception with the specified cause.
     *
     * @param cause the underlying cause of the failure
     */
    public TransportException(Throwable cause) {
        super(cause);
    }
}
