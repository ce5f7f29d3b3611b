package express.mvp.courier.transport.serialization;

/** Thrown when no serializer or deserializer is registered for a type id. */
public class UnknownMessageTypeException extends SerializationException {

    public UnknownMessageTypeException(int typeId) {
        super(typeId, "No serializer registered for message type id " + typeId);
    }
}
