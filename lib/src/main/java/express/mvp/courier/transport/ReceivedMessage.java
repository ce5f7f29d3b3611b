package express.mvp.courier.transport;

import express.mvp.courier.transport.serialization.Message;

/**
 * A message together with the connection it arrived on.
 *
 * @param connection the source connection
 * @param message the message
 */
public record ReceivedMessage(Connection connection, Message message) {}
