package express.mvp.courier.transport.framing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Encodes frames and decodes frame headers for the Courier wire protocol.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌──────────────────────┬────────────────────────┬──────────────────────────┐
 * │ Type id (2 bytes, LE)│  Length (4 bytes, LE)  │     Payload (N bytes)    │
 * └──────────────────────┴────────────────────────┴──────────────────────────┘
 *          ▲                        ▲                          ▲
 *   unsigned 16-bit          signed 32-bit, N              exactly N bytes
 *                        0 &lt;= N &lt;= maxPayloadSize
 * </pre>
 *
 * <p>Both header fields are little-endian. The layout is a compatibility contract with existing
 * peers and must not change.
 *
 * <h2>Configuration</h2>
 *
 * <p>The maximum payload size is configurable at construction time. The default is 16 MB
 * ({@value #DEFAULT_MAX_PAYLOAD_SIZE} bytes). A lower limit gives better protection against
 * malformed length fields.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @see FrameReceiver
 * @see FrameSender
 */
public final class FrameCodec {

    /** Size of the type id field in bytes. */
    public static final int TYPE_ID_SIZE = 2;

    /** Size of the length field in bytes. */
    public static final int LENGTH_SIZE = 4;

    /** Total header size in bytes. */
    public static final int HEADER_SIZE = TYPE_ID_SIZE + LENGTH_SIZE;

    /** Largest type id the header can carry. */
    public static final int MAX_TYPE_ID = 0xFFFF;

    /** Byte order of both header fields. */
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    /** The default maximum payload size: 16 MB. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private static final FrameCodec DEFAULT = new FrameCodec();

    private final int maxPayloadSize;

    /** Creates a codec with the default maximum payload size. */
    public FrameCodec() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    /**
     * Creates a codec with the specified maximum payload size.
     *
     * @param maxPayloadSize the maximum payload size in bytes
     * @throws IllegalArgumentException if maxPayloadSize is not positive or would overflow the
     *     frame size
     */
    public FrameCodec(int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        if (maxPayloadSize > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxPayloadSize too large, would overflow frame size: " + maxPayloadSize);
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    /**
     * Returns the shared codec with the default limits.
     *
     * @return the default codec
     */
    public static FrameCodec defaultCodec() {
        return DEFAULT;
    }

    /**
     * Encodes a frame into one contiguous array (header followed by payload).
     *
     * @param frame the frame to encode
     * @return the encoded bytes, {@code HEADER_SIZE + payloadLength} long
     * @throws FramingException if the payload exceeds {@link #getMaxPayloadSize()}
     */
    public byte[] encode(Frame frame) {
        Objects.requireNonNull(frame, "frame");
        int payloadLength = frame.payloadLength();
        if (payloadLength > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Payload size %d exceeds maximum allowed size %d", payloadLength, maxPayloadSize));
        }

        byte[] encoded = new byte[HEADER_SIZE + payloadLength];
        ByteBuffer.wrap(encoded)
                .order(BYTE_ORDER)
                .putShort((short) frame.typeId())
                .putInt(payloadLength)
                .put(frame.payload());
        return encoded;
    }

    /**
     * Decodes and validates a frame header.
     *
     * @param source array holding at least {@link #HEADER_SIZE} bytes from {@code offset}
     * @param offset position of the header
     * @return the decoded header
     * @throws FramingException if the length field is negative or exceeds the maximum
     */
    public Header decodeHeader(byte[] source, int offset) {
        Objects.checkFromIndexSize(offset, HEADER_SIZE, source.length);
        ByteBuffer buffer = ByteBuffer.wrap(source, offset, HEADER_SIZE).order(BYTE_ORDER);
        int typeId = buffer.getShort() & 0xFFFF;
        int payloadLength = buffer.getInt();

        if (payloadLength < 0) {
            throw new FramingException("Invalid negative length field: " + payloadLength);
        }
        if (payloadLength > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Length field %d exceeds maximum allowed size %d", payloadLength, maxPayloadSize));
        }
        return new Header(typeId, payloadLength);
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    @Override
    public String toString() {
        return String.format("FrameCodec[headerSize=%d, maxPayloadSize=%d, byteOrder=%s]",
                HEADER_SIZE, maxPayloadSize, BYTE_ORDER);
    }

    /**
     * A decoded frame header.
     *
     * @param typeId the message type discriminator
     * @param payloadLength number of payload bytes that follow
     */
    public record Header(int typeId, int payloadLength) {}
}
