package express.mvp.courier.transport;

import express.mvp.courier.transport.serialization.Message;

/**
 * Receives every message a {@link MessageReceiveLoop} deserializes.
 *
 * <p>Messages of one connection arrive in order, one at a time, on the loop's thread. Anything the
 * handler throws is logged and the loop continues with the next frame. Long-running work should
 * be handed off, for example through a {@link ReceivedMessageQueue}.
 */
@FunctionalInterface
public interface MessageReceivedHandler {

    /**
     * Called for each message.
     *
     * @param connection the connection the message arrived on
     * @param message the deserialized message
     */
    void onMessageReceived(Connection connection, Message message);
}
