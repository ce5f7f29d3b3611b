package express.mvp.courier.transport;

import java.util.Objects;

/**
 * Immutable address of a bind or connect target.
 *
 * <p>An endpoint carries the fields relevant to its {@link TransportKind} only:
 *
 * <ul>
 *   <li>{@link TransportKind#NETWORK}: {@code host} and {@code port}; {@code name} is null
 *   <li>{@link TransportKind#VIRTUAL}: {@code name}; {@code host} is null and {@code port} is -1
 * </ul>
 *
 * <p>Endpoints have value semantics and are used as keys by the virtual transport registry.
 *
 * <pre>{@code
 * Endpoint tcp = Endpoint.network("localhost", 5555);
 * Endpoint local = Endpoint.virtual("orders");
 * }</pre>
 */
public final class Endpoint {

    /** Highest valid TCP port. */
    public static final int MAX_PORT = 65535;

    private final TransportKind transportKind;
    private final String host;
    private final int port;
    private final String name;

    private Endpoint(TransportKind transportKind, String host, int port, String name) {
        this.transportKind = transportKind;
        this.host = host;
        this.port = port;
        this.name = name;
    }

    /**
     * Creates a network endpoint.
     *
     * @param host host name or address; {@code *} and {@code 0.0.0.0} mean every interface
     * @param port TCP port, 0 for an ephemeral port when binding
     * @return the endpoint
     * @throws IllegalArgumentException if the host is blank or the port is out of range
     */
    public static Endpoint network(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Network endpoint requires a host");
        }
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        return new Endpoint(TransportKind.NETWORK, host.trim(), port, null);
    }

    /**
     * Creates a virtual (in-process) endpoint.
     *
     * @param name name the accepter registers under
     * @return the endpoint
     * @throws IllegalArgumentException if the name is blank
     */
    public static Endpoint virtual(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Virtual endpoint requires a name");
        }
        return new Endpoint(TransportKind.VIRTUAL, null, -1, name);
    }

    /**
     * Returns a copy of this network endpoint with a different port.
     *
     * <p>Used by accepters to report the port the OS picked for an ephemeral bind.
     *
     * @param newPort the port
     * @return the new endpoint
     * @throws IllegalStateException if this is not a network endpoint
     */
    public Endpoint withPort(int newPort) {
        if (transportKind != TransportKind.NETWORK) {
            throw new IllegalStateException("Only network endpoints have a port: " + this);
        }
        return network(host, newPort);
    }

    public TransportKind getTransportKind() {
        return transportKind;
    }

    /**
     * Returns the host of a network endpoint.
     *
     * @return the host, or null for virtual endpoints
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the port of a network endpoint.
     *
     * @return the port, or -1 for virtual endpoints
     */
    public int getPort() {
        return port;
    }

    /**
     * Returns the name of a virtual endpoint.
     *
     * @return the name, or null for network endpoints
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Endpoint)) {
            return false;
        }
        Endpoint other = (Endpoint) o;
        return transportKind == other.transportKind
                && port == other.port
                && Objects.equals(host, other.host)
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transportKind, host, port, name);
    }

    @Override
    public String toString() {
        return transportKind == TransportKind.NETWORK
                ? transportKind.scheme() + "://" + host + ":" + port
                : transportKind.scheme() + "://" + name;
    }
}
