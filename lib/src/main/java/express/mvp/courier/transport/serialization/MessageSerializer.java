package express.mvp.courier.transport.serialization;

/**
 * Converts a message into its payload bytes.
 *
 * @param <T> the message type
 */
@FunctionalInterface
public interface MessageSerializer<T extends Message> {

    /**
     * Serializes the message.
     *
     * @param message the message, never null
     * @return payload bytes, never null
     * @throws Exception any failure; reported as {@link MalformedPayloadException}
     */
    byte[] serialize(T message) throws Exception;
}
