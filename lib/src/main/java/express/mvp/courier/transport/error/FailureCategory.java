package express.mvp.courier.transport.error;

/**
 * Categories of failures seen by the background loops, and what a loop does about each.
 *
 * <table border="1">
 *   <caption>Loop reaction per category</caption>
 *   <tr><th>Category</th><th>Reported</th><th>Loop</th></tr>
 *   <tr><td>SHUTDOWN</td><td>no</td><td>exits quietly</td></tr>
 *   <tr><td>FRAME</td><td>socket-exception callback</td><td>drops the frame, continues</td></tr>
 *   <tr><td>CONNECTION</td><td>socket-exception callback</td><td>exits</td></tr>
 *   <tr><td>HANDLER</td><td>logged</td><td>continues</td></tr>
 *   <tr><td>CONFIGURATION</td><td>thrown to the caller</td><td>not applicable</td></tr>
 * </table>
 *
 * @see FailureClassifier
 */
public enum FailureCategory {

    /**
     * Expected shutdown: end of stream, connection closed, cancellation.
     *
     * <p>Recommended action: none.
     */
    SHUTDOWN(false, true, "Expected shutdown - exit quietly"),

    /**
     * A single frame could not be turned into a message (unknown type id, payload rejected by the
     * deserializer). The stream itself is intact.
     *
     * <p>Recommended action: report, drop the frame, keep reading.
     */
    FRAME(true, false, "Frame rejected - drop and continue"),

    /**
     * The connection can no longer be read: socket errors, receive timeouts, corrupt framing.
     *
     * <p>Recommended action: report once, stop reading, let the owner close the connection.
     */
    CONNECTION(true, true, "Connection failure - report and exit"),

    /**
     * An application callback threw.
     *
     * <p>Recommended action: log it; never let it change loop control flow.
     */
    HANDLER(false, false, "Handler failure - isolate and continue"),

    /**
     * A setup call was made in an impossible state (already bound, not listening...).
     *
     * <p>Recommended action: thrown synchronously to the immediate caller.
     */
    CONFIGURATION(false, false, "Configuration error - caller must handle");

    private final boolean reported;
    private final boolean terminatesLoop;
    private final String description;

    FailureCategory(boolean reported, boolean terminatesLoop, String description) {
        this.reported = reported;
        this.terminatesLoop = terminatesLoop;
        this.description = description;
    }

    /**
     * Checks if failures of this category go to the socket-exception callback.
     *
     * @return true for {@link #FRAME} and {@link #CONNECTION}
     */
    public boolean isReported() {
        return reported;
    }

    /**
     * Checks if a receive loop exits after a failure of this category.
     *
     * @return true for {@link #SHUTDOWN} and {@link #CONNECTION}
     */
    public boolean terminatesLoop() {
        return terminatesLoop;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String getDescription() {
        return description;
    }
}
