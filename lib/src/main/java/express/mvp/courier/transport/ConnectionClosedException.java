package express.mvp.courier.transport;

import java.io.EOFException;

/**
 * Signals that a connection reached end of stream or was closed.
 *
 * <p>Receive loops treat this as expected shutdown: they exit quietly without reporting it.
 */
public class ConnectionClosedException extends EOFException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message the detail message
     */
    public ConnectionClosedException(String message) {
        super(message);
    }

    /**
     * Creates a new exception carrying the I/O error that revealed the closure.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public ConnectionClosedException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
