package express.mvp.courier.transport.serialization;

/**
 * A typed application message carried in one frame.
 *
 * <p>The type id selects the serializer and deserializer registered in a
 * {@link SerializationRegistry} and travels in the frame header. It must be in {@code 0..65535}.
 */
public interface Message {

    /**
     * Returns the wire type discriminator of this message.
     *
     * @return type id, unsigned 16-bit
     */
    int getMessageTypeId();
}
