package express.mvp.courier.transport.error;

import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.OperationCancelledException;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.framing.FramingException;
import express.mvp.courier.transport.serialization.SerializationException;
import java.io.IOException;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;

/**
 * Classifies throwables raised inside the loops into {@link FailureCategory} values.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Configuration errors ({@link TransportConfigurationException})
 *   <li>Per-frame serialization errors ({@link SerializationException})
 *   <li>Expected shutdown: end of stream, closed channels, cancellation and interruption
 *   <li>Everything else thrown while reading ({@link IOException}, {@link FramingException}) is a
 *       connection failure
 *   <li>Any other throwable is treated as a connection failure as well
 * </ol>
 *
 * <p>{@link FailureCategory#HANDLER} is never produced here: the loops know when they are calling
 * application code and assign that category themselves.
 *
 * <pre>{@code
 * FailureCategory category = FailureClassifier.classify(e);
 * if (category.isReported()) {
 *     socketExceptionHandler.onSocketException(connection, e);
 * }
 * if (category.terminatesLoop()) {
 *     return;
 * }
 * }</pre>
 */
public final class FailureClassifier {

    private FailureClassifier() {
        // Utility class
    }

    /**
     * Classifies a throwable.
     *
     * @param throwable the failure; null is treated as a connection failure
     * @return the category
     */
    public static FailureCategory classify(Throwable throwable) {
        if (throwable instanceof TransportConfigurationException) {
            return FailureCategory.CONFIGURATION;
        }
        if (throwable instanceof SerializationException) {
            return FailureCategory.FRAME;
        }
        if (isShutdown(throwable)) {
            return FailureCategory.SHUTDOWN;
        }
        return FailureCategory.CONNECTION;
    }

    /**
     * Checks if the throwable signals expected shutdown rather than a fault.
     *
     * @param throwable the failure
     * @return true for end of stream, closed channels and cancellation
     */
    public static boolean isShutdown(Throwable throwable) {
        // ClosedByInterruptException is an AsynchronousCloseException
        return throwable instanceof ConnectionClosedException
                || throwable instanceof OperationCancelledException
                || throwable instanceof InterruptedException
                || throwable instanceof AsynchronousCloseException
                || throwable instanceof ClosedChannelException
                || throwable instanceof ClosedSelectorException;
    }
}
