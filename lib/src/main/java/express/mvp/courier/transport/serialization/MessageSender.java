package express.mvp.courier.transport.serialization;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.framing.FrameCodec;
import express.mvp.courier.transport.framing.FrameSender;
import java.io.IOException;
import java.util.Objects;

/**
 * Serializes messages and writes them as single frames.
 *
 * <p>Stateless apart from its registry and codec, so one sender can serve any number of
 * connections and threads.
 */
public final class MessageSender {

    private final SerializationRegistry registry;
    private final FrameCodec codec;

    public MessageSender(SerializationRegistry registry) {
        this(registry, FrameCodec.defaultCodec());
    }

    public MessageSender(SerializationRegistry registry, FrameCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Serializes the message and writes it to the connection in one write.
     *
     * @param connection destination
     * @param message the message
     * @throws SerializationException if the message cannot be serialized; nothing is written
     * @throws IOException if the write fails
     */
    public void send(Connection connection, Message message) throws IOException {
        new FrameSender(connection, codec).send(registry.serialize(message));
    }

    public SerializationRegistry getRegistry() {
        return registry;
    }
}
