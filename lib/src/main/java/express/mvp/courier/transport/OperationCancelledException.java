package express.mvp.courier.transport;

import java.io.InterruptedIOException;

/**
 * Signals that a blocking read, write or accept was cancelled by interrupting its thread.
 *
 * <p>Loops use thread interruption as their cooperative cancellation signal. Every blocking point
 * in this library converts the interruption into this exception so the loop can exit quietly. The
 * thread's interrupt status is preserved.
 */
public class OperationCancelledException extends InterruptedIOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message the detail message
     */
    public OperationCancelledException(String message) {
        super(message);
    }
}
