package express.mvp.courier.transport.serialization;

/**
 * Rebuilds a message from its payload bytes.
 *
 * @param <T> the message type
 */
@FunctionalInterface
public interface MessageDeserializer<T extends Message> {

    /**
     * Deserializes a payload.
     *
     * @param payload payload bytes of one frame
     * @return the message; returning null is treated as a malformed payload
     * @throws Exception any failure; reported as {@link MalformedPayloadException}
     */
    T deserialize(byte[] payload) throws Exception;
}
