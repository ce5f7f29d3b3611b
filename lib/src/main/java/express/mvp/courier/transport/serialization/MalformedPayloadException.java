package express.mvp.courier.transport.serialization;

/**
 * Thrown when a registered serializer or deserializer fails.
 *
 * <p>The original failure, if any, is attached as the cause.
 */
public class MalformedPayloadException extends SerializationException {

    public MalformedPayloadException(int typeId, String message) {
        super(typeId, message);
    }

    public MalformedPayloadException(int typeId, String message, Throwable cause) {
        super(typeId, message, cause);
    }
}
