package express.mvp.courier.transport.virtual;

import express.mvp.courier.transport.AbstractAcceptLoop;
import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.LoopThreadFactory;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.OperationCancelledException;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportKind;
import express.mvp.courier.transport.error.RetryPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;

/**
 * Accepts in-process connections from a {@link VirtualTransportRegistry}.
 *
 * <p>{@link #bind} registers the endpoint synchronously, so a {@code connect} issued after it
 * returns always succeeds. The loop takes pending ends off the registration queue. {@link #unbind}
 * removes the registration and closes any end that was connected but not yet accepted; their
 * connectors then read end of stream.
 *
 * <p>Socket options have no meaning for virtual connections; the configuration is still passed to
 * the connected handler.
 */
public final class VirtualAcceptLoop extends AbstractAcceptLoop<BlockingQueue<VirtualConnection>> {

    private final VirtualTransportRegistry registry;

    /** Creates an accept loop over the process-wide registry. */
    public VirtualAcceptLoop() {
        this(VirtualTransportRegistry.defaultInstance());
    }

    public VirtualAcceptLoop(VirtualTransportRegistry registry) {
        this(registry, LoopThreadFactory.ACCEPT, RetryPolicy.acceptDefault());
    }

    public VirtualAcceptLoop(
            VirtualTransportRegistry registry, ThreadFactory threadFactory, RetryPolicy retryPolicy) {
        super("virtual-accept", threadFactory, retryPolicy);
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    protected void checkEndpoint(Endpoint endpoint) {
        TransportConfigurationException.requireKind(endpoint, TransportKind.VIRTUAL);
    }

    @Override
    protected BlockingQueue<VirtualConnection> openListener(Endpoint endpoint) {
        return registry.registerAccepter(endpoint);
    }

    @Override
    protected Endpoint boundEndpoint(BlockingQueue<VirtualConnection> listener, Endpoint requested) {
        return requested;
    }

    @Override
    protected Connection accept(
            BlockingQueue<VirtualConnection> listener,
            Endpoint boundEndpoint,
            NodeType nodeType,
            SocketConfiguration socketConfiguration)
            throws OperationCancelledException {
        try {
            return listener.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Accept cancelled on " + boundEndpoint);
        }
    }

    @Override
    protected void closeListener(BlockingQueue<VirtualConnection> listener, Endpoint boundEndpoint) {
        registry.unregisterAccepter(boundEndpoint);
        List<VirtualConnection> pending = new ArrayList<>();
        listener.drainTo(pending);
        for (VirtualConnection connection : pending) {
            connection.close();
        }
    }

    public VirtualTransportRegistry getRegistry() {
        return registry;
    }
}
