package express.mvp.courier.transport.serialization;

import express.mvp.courier.transport.framing.Frame;
import express.mvp.courier.transport.framing.FrameCodec;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps message type ids to serializer and deserializer pairs.
 *
 * <p>Registration is additive: registering a type id again replaces the previous pair (last
 * writer wins) and there is no removal. Lookups and registrations may run concurrently from any
 * thread.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SerializationRegistry registry = new SerializationRegistry();
 * registry.register(
 *     Ping.TYPE_ID,
 *     Ping.class,
 *     ping -> ping.toBytes(),
 *     Ping::fromBytes);
 *
 * Frame frame = registry.serialize(new Ping(42));
 * Message decoded = registry.deserialize(frame.typeId(), frame.payload());
 * }</pre>
 *
 * <p>Components take a registry explicitly. {@link #defaultInstance()} exists for callers that
 * want one process-wide registry.
 */
public final class SerializationRegistry {

    private static final SerializationRegistry DEFAULT = new SerializationRegistry();

    private final Map<Integer, Registration<?>> registrations = new ConcurrentHashMap<>();

    /**
     * Returns the process-wide registry.
     *
     * @return the shared instance
     */
    public static SerializationRegistry defaultInstance() {
        return DEFAULT;
    }

    /**
     * Registers the serializer and deserializer for a type id.
     *
     * @param typeId wire type id, {@code 0..65535}
     * @param type message class serialized under this id
     * @param serializer converts messages to payload bytes
     * @param deserializer converts payload bytes to messages
     * @param <T> the message type
     * @throws IllegalArgumentException if the type id is out of range
     */
    public <T extends Message> void register(
            int typeId,
            Class<T> type,
            MessageSerializer<T> serializer,
            MessageDeserializer<T> deserializer) {
        if (typeId < 0 || typeId > FrameCodec.MAX_TYPE_ID) {
            throw new IllegalArgumentException("Type id out of range: " + typeId);
        }
        registrations.put(typeId, new Registration<>(
                Objects.requireNonNull(type, "type"),
                Objects.requireNonNull(serializer, "serializer"),
                Objects.requireNonNull(deserializer, "deserializer")));
    }

    /**
     * Checks whether a type id has a registration.
     *
     * @param typeId the type id
     * @return true if registered
     */
    public boolean isRegistered(int typeId) {
        return registrations.containsKey(typeId);
    }

    /**
     * Returns the message class registered for a type id.
     *
     * @param typeId the type id
     * @return the class, or null if nothing is registered
     */
    public Class<? extends Message> getMessageType(int typeId) {
        Registration<?> registration = registrations.get(typeId);
        return registration == null ? null : registration.type();
    }

    /**
     * Converts a frame payload back into a message.
     *
     * @param typeId type id from the frame header
     * @param payload the frame payload
     * @return the message, never null
     * @throws UnknownMessageTypeException if nothing is registered for the type id
     * @throws MalformedPayloadException if the deserializer fails or returns null
     */
    public Message deserialize(int typeId, byte[] payload) {
        Registration<?> registration = registrations.get(typeId);
        if (registration == null) {
            throw new UnknownMessageTypeException(typeId);
        }
        Message message;
        try {
            message = registration.deserializer().deserialize(payload);
        } catch (Exception e) {
            throw new MalformedPayloadException(typeId,
                    "Failed to deserialize " + payload.length + " byte payload of type id " + typeId,
                    e);
        }
        if (message == null) {
            throw new MalformedPayloadException(typeId,
                    "Deserializer for type id " + typeId + " returned null");
        }
        return message;
    }

    /**
     * Converts a message into a frame.
     *
     * @param message the message
     * @return frame carrying the message's type id and serialized payload
     * @throws UnknownMessageTypeException if nothing is registered for the message's type id
     * @throws MalformedPayloadException if the serializer fails, returns null or the message is
     *     not of the registered class
     */
    public Frame serialize(Message message) {
        Objects.requireNonNull(message, "message");
        int typeId = message.getMessageTypeId();
        Registration<?> registration = registrations.get(typeId);
        if (registration == null) {
            throw new UnknownMessageTypeException(typeId);
        }
        return new Frame(typeId, registration.serialize(typeId, message));
    }

    private record Registration<T extends Message>(
            Class<T> type, MessageSerializer<T> serializer, MessageDeserializer<T> deserializer) {

        byte[] serialize(int typeId, Message message) {
            if (!type.isInstance(message)) {
                throw new MalformedPayloadException(typeId, "Type id " + typeId + " is registered for "
                        + type.getName() + ", not " + message.getClass().getName());
            }
            byte[] payload;
            try {
                payload = serializer.serialize(type.cast(message));
            } catch (Exception e) {
                throw new MalformedPayloadException(typeId,
                        "Failed to serialize " + message.getClass().getName(), e);
            }
            if (payload == null) {
                throw new MalformedPayloadException(typeId,
                        "Serializer for type id " + typeId + " returned null");
            }
            return payload;
        }
    }
}
