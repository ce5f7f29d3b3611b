package express.mvp.courier.transport.framing;

import express.mvp.courier.transport.Connection;
import java.io.IOException;
import java.util.Objects;

/**
 * Writes frames to a {@link Connection}.
 *
 * <p>Each frame is encoded into one array and handed to the connection in a single write, so
 * frames sent concurrently from several threads are never interleaved on the wire.
 */
public final class FrameSender {

    private final Connection connection;
    private final FrameCodec codec;

    public FrameSender(Connection connection) {
        this(connection, FrameCodec.defaultCodec());
    }

    public FrameSender(Connection connection, FrameCodec codec) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Encodes and writes one frame.
     *
     * @param frame the frame
     * @throws FramingException if the payload exceeds the codec limit
     * @throws IOException if the write fails
     */
    public void send(Frame frame) throws IOException {
        connection.write(codec.encode(frame));
    }

    /**
     * Writes a frame built from a type id and payload.
     *
     * @param typeId message type id
     * @param payload serialized payload
     * @throws IOException if the write fails
     */
    public void send(int typeId, byte[] payload) throws IOException {
        send(new Frame(typeId, payload));
    }
}
