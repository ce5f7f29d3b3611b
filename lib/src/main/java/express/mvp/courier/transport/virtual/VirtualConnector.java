package express.mvp.courier.transport.virtual;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.SocketConnector;
import java.util.Objects;

/** Connects to virtual endpoints through a {@link VirtualTransportRegistry}. Never blocks. */
public final class VirtualConnector implements SocketConnector {

    private final VirtualTransportRegistry registry;

    public VirtualConnector() {
        this(VirtualTransportRegistry.defaultInstance());
    }

    public VirtualConnector(VirtualTransportRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Connection connect(Endpoint endpoint, SocketConfiguration socketConfiguration) {
        return registry.connect(endpoint);
    }
}
