package express.mvp.courier.transport;

import java.io.IOException;

/**
 * One established, bidirectional, ordered byte stream between two parties.
 *
 * <p>This is the single abstraction the accept and receive loops operate over, so the same loop
 * logic runs unchanged whether bytes travel through a TCP socket or an in-memory queue.
 *
 * <h2>Ownership</h2>
 *
 * <p>A connection is owned by whoever created or accepted it. Accepters hand ownership to the
 * application through {@link ClientConnectedHandler}; a {@link MessageReceiveLoop} only borrows the
 * connection for reading and never closes it.
 *
 * <h2>Disconnect Notification</h2>
 *
 * <p>The connection fires its disconnected notification exactly once: the first time a reader
 * observes end of stream or a fatal I/O error, or when {@link #close()} is called, whichever comes
 * first. Every registered {@link DisconnectListener} is invoked once.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>One thread may read while any number of threads write. Each {@link #write} call is atomic
 * with respect to other writes, so a whole frame written in one call is never interleaved with
 * another.
 *
 * @see express.mvp.courier.transport.tcp.NetworkConnection
 * @see express.mvp.courier.transport.virtual.VirtualConnection
 */
public interface Connection extends AutoCloseable {

    /**
     * Returns the endpoint this connection was accepted on or connected to.
     *
     * @return the endpoint, never null
     */
    Endpoint getEndpoint();

    /**
     * Reads up to {@code length} bytes, blocking until at least one byte is available.
     *
     * @param buffer destination array
     * @param offset offset in the destination
     * @param length maximum number of bytes to read, positive
     * @return the number of bytes read, or -1 at end of stream
     * @throws OperationCancelledException if the reading thread is interrupted
     * @throws java.net.SocketTimeoutException if a receive timeout applies and elapses
     * @throws IOException on any other I/O failure
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes all {@code length} bytes, blocking until they are handed to the transport.
     *
     * @param buffer source array
     * @param offset offset in the source
     * @param length number of bytes to write
     * @throws ConnectionClosedException if the connection or its peer is closed
     * @throws OperationCancelledException if the writing thread is interrupted
     * @throws java.net.SocketTimeoutException if the send timeout elapses
     * @throws IOException on any other I/O failure
     */
    void write(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes a whole array.
     *
     * @param buffer the bytes to write
     * @throws IOException as for {@link #write(byte[], int, int)}
     */
    default void write(byte[] buffer) throws IOException {
        write(buffer, 0, buffer.length);
    }

    /**
     * Closes the connection for reading; a blocked or later read returns end of stream.
     *
     * <p>Writes are unaffected. Safe to call more than once.
     */
    void shutdownInput();

    /**
     * Checks whether the connection is still usable.
     *
     * @return false once closed or disconnected
     */
    boolean isConnected();

    /**
     * Registers a listener for the one-shot disconnected notification.
     *
     * <p>If the notification has already fired the listener is invoked immediately on the calling
     * thread.
     *
     * @param listener the listener
     */
    void addDisconnectListener(DisconnectListener listener);

    /** Closes the connection. Idempotent; fires the disconnected notification if not yet fired. */
    @Override
    void close();
}
