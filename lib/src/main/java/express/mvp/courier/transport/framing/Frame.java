package express.mvp.courier.transport.framing;

import java.util.Arrays;
import java.util.Objects;

/**
 * One wire unit: a message type discriminator and its serialized payload.
 *
 * <p>The payload array is not copied. A frame handed to the application layer is always complete;
 * receivers never expose a partially read payload.
 *
 * @param typeId unsigned 16-bit message type discriminator
 * @param payload serialized message bytes
 */
public record Frame(int typeId, byte[] payload) {

    /**
     * Validates the type id range and the payload reference.
     *
     * @throws FramingException if the type id does not fit in the wire header
     */
    public Frame {
        if (typeId < 0 || typeId > FrameCodec.MAX_TYPE_ID) {
            throw new FramingException("Type id out of range: " + typeId);
        }
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Returns the payload length.
     *
     * @return number of payload bytes
     */
    public int payloadLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return typeId == other.typeId && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * typeId + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[typeId=" + typeId + ", payloadLength=" + payload.length + "]";
    }
}
