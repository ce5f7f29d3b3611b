package express.mvp.courier.transport;

import express.mvp.courier.transport.tcp.NetworkAcceptLoop;
import express.mvp.courier.transport.tcp.NetworkConnector;
import express.mvp.courier.transport.virtual.VirtualAcceptLoop;
import express.mvp.courier.transport.virtual.VirtualConnector;
import express.mvp.courier.transport.virtual.VirtualTransportRegistry;
import java.util.Objects;

/**
 * Creates accepters and connectors by transport kind.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Endpoint endpoint = Endpoint.virtual("pricing");
 * VirtualTransportRegistry registry = new VirtualTransportRegistry();
 *
 * SocketAccepter accepter = TransportFactory.createAccepter(endpoint.getTransportKind(), registry);
 * accepter.bind(endpoint, NodeType.RESPONDER, SocketConfiguration.DEFAULT, onConnected, onDisconnected);
 *
 * SocketConnector connector =
 *     TransportFactory.createConnector(endpoint.getTransportKind(), NodeType.REQUESTER, registry);
 * Connection connection = connector.connect(endpoint);
 * }</pre>
 *
 * <p>This factory is thread-safe.
 */
public final class TransportFactory {

    private TransportFactory() {
        // Utility class
    }

    /**
     * Creates an accepter using the process-wide virtual registry.
     *
     * @param kind the transport kind
     * @return a new, unbound accepter
     */
    public static SocketAccepter createAccepter(TransportKind kind) {
        return createAccepter(kind, VirtualTransportRegistry.defaultInstance());
    }

    /**
     * Creates an accepter.
     *
     * @param kind the transport kind
     * @param registry registry for virtual endpoints; unused for network accepters
     * @return a new, unbound accepter
     */
    public static SocketAccepter createAccepter(TransportKind kind, VirtualTransportRegistry registry) {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case NETWORK:
                return new NetworkAcceptLoop();
            case VIRTUAL:
                return new VirtualAcceptLoop(registry);
            default:
                throw new IllegalArgumentException("Unknown transport kind: " + kind);
        }
    }

    /**
     * Creates a connector using the process-wide virtual registry.
     *
     * @param kind the transport kind
     * @param nodeType node type of the connecting side
     * @return a new connector
     */
    public static SocketConnector createConnector(TransportKind kind, NodeType nodeType) {
        return createConnector(kind, nodeType, VirtualTransportRegistry.defaultInstance());
    }

    /**
     * Creates a connector.
     *
     * @param kind the transport kind
     * @param nodeType node type of the connecting side; decides the receive timeout on TCP
     * @param registry registry for virtual endpoints; unused for network connectors
     * @return a new connector
     */
    public static SocketConnector createConnector(
            TransportKind kind, NodeType nodeType, VirtualTransportRegistry registry) {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case NETWORK:
                return new NetworkConnector(nodeType);
            case VIRTUAL:
                return new VirtualConnector(registry);
            default:
                throw new IllegalArgumentException("Unknown transport kind: " + kind);
        }
    }
}
