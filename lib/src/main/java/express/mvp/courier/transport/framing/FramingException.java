package express.mvp.courier.transport.framing;

import express.mvp.courier.transport.TransportException;

/**
 * Exception thrown when a frame header is invalid.
 *
 * <p>This exception indicates protocol-level errors in the framing layer, such as:
 *
 * <ul>
 *   <li><b>Oversized frames:</b> The length field exceeds the configured maximum payload size
 *   <li><b>Invalid length field:</b> The length field is negative
 *   <li><b>Invalid type id:</b> A type id outside the unsigned 16-bit range was framed
 * </ul>
 *
 * <h2>Error Recovery</h2>
 *
 * <p>When a {@code FramingException} is raised while receiving, the byte stream is no longer
 * aligned on frame boundaries and cannot be resynchronized. The receive loop reports it through
 * the socket-exception callback and stops reading; the owner should close the connection.
 *
 * <h2>Security Considerations</h2>
 *
 * <p>The maximum payload check runs before the payload buffer is allocated, so a peer cannot make
 * the receiver allocate an arbitrary amount of memory by sending a huge length field.
 *
 * @see FrameCodec
 */
public class FramingException extends TransportException {

    /**
     * Constructs a new framing exception with the specified detail message.
     *
     * @param message the detail message describing the framing error
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a new framing exception with the specified detail message and cause.
     *
     * @param message the detail message describing the framing error
     * @param cause the underlying cause of the framing error
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
