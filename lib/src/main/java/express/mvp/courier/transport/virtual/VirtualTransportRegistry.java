package express.mvp.courier.transport.virtual;

import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportConfigurationException.Reason;
import express.mvp.courier.transport.TransportKind;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Directory of virtual endpoints that have an accepter listening.
 *
 * <p>Each registered endpoint owns a queue of pending accepter ends. {@link #connect(Endpoint)}
 * creates a connection pair, enqueues the accepter end and returns the connector end immediately;
 * the accepter picks the pending end up from its queue.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * VirtualTransportRegistry registry = new VirtualTransportRegistry();
 * Endpoint endpoint = Endpoint.virtual("orders");
 *
 * BlockingQueue<VirtualConnection> pending = registry.registerAccepter(endpoint);
 * VirtualConnection client = registry.connect(endpoint);
 * VirtualConnection server = pending.take();
 * }</pre>
 *
 * <p>Thread-safe. Registries are passed to components explicitly; {@link #defaultInstance()} is a
 * process-wide convenience.
 */
public final class VirtualTransportRegistry {

    private static final VirtualTransportRegistry DEFAULT = new VirtualTransportRegistry();

    private final ConcurrentMap<Endpoint, BlockingQueue<VirtualConnection>> accepters =
            new ConcurrentHashMap<>();

    public static VirtualTransportRegistry defaultInstance() {
        return DEFAULT;
    }

    /**
     * Registers an accepter for an endpoint.
     *
     * @param endpoint a virtual endpoint
     * @return the new, empty queue of pending accepter ends
     * @throws TransportConfigurationException {@code INVALID_TRANSPORT} for a non-virtual endpoint,
     *     {@code ALREADY_REGISTERED} if an accepter is already registered
     */
    public BlockingQueue<VirtualConnection> registerAccepter(Endpoint endpoint) {
        TransportConfigurationException.requireKind(endpoint, TransportKind.VIRTUAL);
        BlockingQueue<VirtualConnection> pending = new LinkedBlockingQueue<>();
        if (accepters.putIfAbsent(endpoint, pending) != null) {
            throw new TransportConfigurationException(
                    Reason.ALREADY_REGISTERED, "An accepter is already registered for " + endpoint);
        }
        return pending;
    }

    /**
     * Connects to a registered accepter without waiting for it to accept.
     *
     * @param endpoint a virtual endpoint
     * @return the connector end
     * @throws TransportConfigurationException {@code INVALID_TRANSPORT} for a non-virtual endpoint,
     *     {@code NOT_LISTENING} if no accepter is registered
     */
    public VirtualConnection connect(Endpoint endpoint) {
        TransportConfigurationException.requireKind(endpoint, TransportKind.VIRTUAL);
        VirtualConnection.Pair pair = VirtualConnection.createPair(endpoint);
        // Enqueue under the map's bin lock so a concurrent unregister cannot orphan the end
        BlockingQueue<VirtualConnection> pending = accepters.computeIfPresent(endpoint, (key, queue) -> {
            queue.add(pair.accepterEnd());
            return queue;
        });
        if (pending == null) {
            throw new TransportConfigurationException(
                    Reason.NOT_LISTENING, "No accepter is listening on " + endpoint);
        }
        return pair.connectorEnd();
    }

    /**
     * Removes the registration for an endpoint. Established connections are unaffected.
     *
     * <p>Once this returns, no further ends are added to the queue that was registered, so its
     * owner can safely drain it.
     *
     * @param endpoint the endpoint
     * @return true if a registration existed
     */
    public boolean unregisterAccepter(Endpoint endpoint) {
        return accepters.remove(endpoint) != null;
    }

    public boolean isRegistered(Endpoint endpoint) {
        return accepters.containsKey(endpoint);
    }
}
