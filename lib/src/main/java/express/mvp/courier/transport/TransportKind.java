package express.mvp.courier.transport;

/**
 * Transport an {@link Endpoint} is reachable over.
 *
 * <p>The scheme is only used for display ({@link Endpoint#toString()}); endpoints are never parsed
 * from strings by this library.
 */
public enum TransportKind {

    /** TCP sockets through the operating system's network stack. */
    NETWORK("tcp"),

    /** In-process duplex byte queues brokered by a virtual transport registry. */
    VIRTUAL("inproc");

    private final String scheme;

    TransportKind(String scheme) {
        this.scheme = scheme;
    }

    /**
     * Returns the URI-style scheme used when rendering endpoints.
     *
     * @return {@code tcp} or {@code inproc}
     */
    public String scheme() {
        return scheme;
    }

    @Override
    public String toString() {
        return scheme;
    }
}
