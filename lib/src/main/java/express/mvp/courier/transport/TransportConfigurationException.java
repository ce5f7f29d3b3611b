package express.mvp.courier.transport;

import java.util.Objects;

/**
 * Thrown synchronously when a bind, register or connect call is made in a state that cannot work.
 *
 * <p>These failures are never reported through a loop callback. They surface immediately to the
 * caller of {@link SocketAccepter#bind}, {@link
 * express.mvp.courier.transport.virtual.VirtualTransportRegistry#registerAccepter} or {@link
 * SocketConnector#connect}, which must handle them.
 *
 * <pre>{@code
 * try {
 *     registry.connect(Endpoint.virtual("orders"));
 * } catch (TransportConfigurationException e) {
 *     if (e.getReason() == TransportConfigurationException.Reason.NOT_LISTENING) {
 *         // nobody bound "orders" yet
 *     }
 * }
 * }</pre>
 */
public class TransportConfigurationException extends TransportException {

    /** Why the call was rejected. */
    public enum Reason {
        /** An accepter is already bound and has not fully stopped. */
        ALREADY_BOUND,

        /** A virtual accepter is already registered for the endpoint. */
        ALREADY_REGISTERED,

        /** No virtual accepter is registered for the endpoint. */
        NOT_LISTENING,

        /** The endpoint's transport kind does not match the component. */
        INVALID_TRANSPORT
    }

    private final Reason reason;

    /**
     * Creates a new exception.
     *
     * @param reason why the call was rejected
     * @param message the detail message
     */
    public TransportConfigurationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Returns why the call was rejected.
     *
     * @return the reason, never null
     */
    public Reason getReason() {
        return reason;
    }

    static TransportConfigurationException invalidTransport(
            Endpoint endpoint, TransportKind expected) {
        return new TransportConfigurationException(
                Reason.INVALID_TRANSPORT,
                "Endpoint " + endpoint + " is not a " + expected + " endpoint");
    }

    /**
     * Verifies that an endpoint uses the expected transport kind.
     *
     * @param endpoint the endpoint to check
     * @param expected the kind the caller supports
     * @throws TransportConfigurationException with {@link Reason#INVALID_TRANSPORT} on mismatch
     */
    public static void requireKind(Endpoint endpoint, TransportKind expected) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpoint.getTransportKind() != expected) {
            throw invalidTransport(endpoint, expected);
        }
    }
}
