package express.mvp.courier.transport.virtual;

import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.OperationCancelledException;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One direction of a virtual connection: an unbounded queue of written chunks.
 *
 * <p>Each write enqueues one defensive copy, so writes are atomic with respect to each other and
 * the reader sees bytes in write order. The reader consumes chunks partially and keeps the rest
 * for the next read.
 *
 * <p>Two ways to end the stream:
 *
 * <ul>
 *   <li>{@link #finish()} - the writer closed; the reader drains what was written, then sees end
 *       of stream
 *   <li>{@link #abort()} - the reader gave up; pending bytes are dropped, the reader sees end of
 *       stream at once and further writes fail
 * </ul>
 *
 * <p>Any number of writers, one reader.
 */
final class BlockingByteQueue {

    /** Marks end of stream inside the chunk queue. */
    private static final byte[] END = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();

    private volatile boolean aborted;

    // Reader-side state
    private byte[] current;
    private int position;
    private boolean endOfStream;

    /**
     * Appends a copy of the given bytes.
     *
     * @throws ConnectionClosedException if the reading side has been aborted
     */
    void write(byte[] buffer, int offset, int length) throws ConnectionClosedException {
        if (aborted) {
            throw new ConnectionClosedException("Peer has closed the connection");
        }
        if (length == 0) {
            return;
        }
        chunks.add(Arrays.copyOfRange(buffer, offset, offset + length));
    }

    /**
     * Reads up to {@code length} bytes, blocking until some are available or the stream ends.
     *
     * @return bytes read, or -1 at end of stream
     * @throws OperationCancelledException if the calling thread is interrupted while waiting
     */
    int read(byte[] buffer, int offset, int length) throws OperationCancelledException {
        if (length == 0) {
            return 0;
        }
        if (aborted) {
            // Drops a partly read chunk as well
            current = null;
            endOfStream = true;
            return -1;
        }
        if (current == null) {
            if (endOfStream) {
                return -1;
            }
            byte[] next;
            try {
                next = chunks.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Read cancelled");
            }
            if (next == END || aborted) {
                endOfStream = true;
                return -1;
            }
            current = next;
            position = 0;
        }

        int count = Math.min(length, current.length - position);
        System.arraycopy(current, position, buffer, offset, count);
        position += count;
        if (position == current.length) {
            current = null;
        }
        return count;
    }

    /** Ends the stream after the bytes already written. */
    void finish() {
        chunks.add(END);
    }

    /** Ends the stream immediately, dropping unread bytes and rejecting writes. */
    void abort() {
        aborted = true;
        chunks.clear();
        chunks.add(END);
    }

    boolean isAborted() {
        return aborted;
    }
}
