package express.mvp.courier.transport.framing;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.ConnectionClosedException;
import java.io.IOException;
import java.util.Objects;

/**
 * Reads whole frames from a {@link Connection}.
 *
 * <p>The receiver keeps its progress through the current frame between calls. When a read is
 * cancelled (the receiving thread was interrupted) or times out partway through a header or a
 * payload, the bytes already consumed are retained and the next {@link #receive()} continues the
 * same frame. A receive loop can therefore be stopped and restarted without losing its place in
 * the stream.
 *
 * <h2>End of Stream</h2>
 *
 * <p>End of stream, whether at a frame boundary or inside a frame, is reported as a
 * {@link ConnectionClosedException}. A truncated frame is never returned.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. A receiver belongs to whichever single thread is currently reading the
 * connection.
 */
public final class FrameReceiver {

    private final Connection connection;
    private final FrameCodec codec;

    private final byte[] header = new byte[FrameCodec.HEADER_SIZE];
    private int headerFilled;

    /** Decoded header of the frame in progress, or null while the header is incomplete. */
    private FrameCodec.Header pending;
    private byte[] payload;
    private int payloadFilled;

    /**
     * Creates a receiver with the default maximum payload size.
     *
     * @param connection the connection to read from
     */
    public FrameReceiver(Connection connection) {
        this(connection, FrameCodec.defaultCodec());
    }

    /**
     * Creates a receiver using the given codec's limits.
     *
     * @param connection the connection to read from
     * @param codec codec used to validate headers
     */
    public FrameReceiver(Connection connection, FrameCodec codec) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Blocks until one complete frame has been read.
     *
     * @return the frame
     * @throws ConnectionClosedException if the stream ends
     * @throws FramingException if the header is invalid
     * @throws IOException if the read is cancelled, times out or fails; partial progress is kept
     */
    public Frame receive() throws IOException {
        while (headerFilled < FrameCodec.HEADER_SIZE) {
            headerFilled += readSome(header, headerFilled, FrameCodec.HEADER_SIZE - headerFilled);
        }
        if (pending == null) {
            pending = codec.decodeHeader(header, 0);
            payload = new byte[pending.payloadLength()];
            payloadFilled = 0;
        }
        while (payloadFilled < payload.length) {
            payloadFilled += readSome(payload, payloadFilled, payload.length - payloadFilled);
        }

        Frame frame = new Frame(pending.typeId(), payload);
        headerFilled = 0;
        pending = null;
        payload = null;
        payloadFilled = 0;
        return frame;
    }

    /**
     * Checks whether part of a frame has been consumed but not yet returned.
     *
     * @return true while mid-frame
     */
    public boolean isMidFrame() {
        return headerFilled > 0;
    }

    public Connection getConnection() {
        return connection;
    }

    private int readSome(byte[] target, int offset, int length) throws IOException {
        int read = connection.read(target, offset, length);
        if (read < 0) {
            throw new ConnectionClosedException(isMidFrame()
                    ? "Connection closed in the middle of a frame: " + connection.getEndpoint()
                    : "Connection closed: " + connection.getEndpoint());
        }
        return read;
    }
}
