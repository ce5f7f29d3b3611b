package express.mvp.courier.transport.tcp;

import express.mvp.courier.transport.AbstractAcceptLoop;
import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.LoopThreadFactory;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportException;
import express.mvp.courier.transport.TransportKind;
import express.mvp.courier.transport.error.RetryPolicy;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts TCP connections on a {@link ServerSocketChannel}.
 *
 * <p>{@link #bind} opens and binds the server channel on the calling thread, so when it returns the
 * OS is already listening and {@link #getBoundEndpoint()} carries the real port (useful with port
 * 0). The channel stays in blocking mode; {@link #unbind} closes it, which ends an in-flight
 * {@code accept()} with an {@link java.nio.channels.AsynchronousCloseException} that the loop
 * treats as normal shutdown.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * NetworkAcceptLoop accepter = new NetworkAcceptLoop();
 * accepter.bind(
 *     Endpoint.network("127.0.0.1", 0),
 *     NodeType.RESPONDER,
 *     SocketConfiguration.DEFAULT,
 *     (connection, config) -> startReceiving(connection),
 *     connection -> forget(connection));
 *
 * int port = accepter.getBoundEndpoint().getPort();
 * // ...
 * accepter.unbind();
 * }</pre>
 *
 * @see NetworkConnection
 */
public final class NetworkAcceptLoop extends AbstractAcceptLoop<ServerSocketChannel> {

    private static final Logger LOGGER = Logger.getLogger(NetworkAcceptLoop.class.getName());

    public NetworkAcceptLoop() {
        this(LoopThreadFactory.ACCEPT, RetryPolicy.acceptDefault());
    }

    public NetworkAcceptLoop(ThreadFactory threadFactory, RetryPolicy retryPolicy) {
        super("network-accept", threadFactory, retryPolicy);
    }

    @Override
    protected void checkEndpoint(Endpoint endpoint) {
        TransportConfigurationException.requireKind(endpoint, TransportKind.NETWORK);
    }

    @Override
    protected ServerSocketChannel openListener(Endpoint endpoint) {
        ServerSocketChannel channel = null;
        try {
            channel = ServerSocketChannel.open();
            channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            channel.bind(HostResolver.resolveLocal(endpoint));
            return channel;
        } catch (IOException e) {
            if (channel != null) {
                closeListener(channel, endpoint);
            }
            throw new TransportException("Failed to bind " + endpoint, e);
        }
    }

    @Override
    protected Endpoint boundEndpoint(ServerSocketChannel listener, Endpoint requested) {
        try {
            InetSocketAddress local = (InetSocketAddress) listener.getLocalAddress();
            return requested.withPort(local.getPort());
        } catch (IOException e) {
            throw new TransportException("Failed to read local address of " + requested, e);
        }
    }

    @Override
    protected Connection accept(
            ServerSocketChannel listener,
            Endpoint boundEndpoint,
            NodeType nodeType,
            SocketConfiguration socketConfiguration)
            throws IOException {
        SocketChannel socket = listener.accept();
        try {
            return NetworkConnection.open(socket, boundEndpoint, nodeType, socketConfiguration);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            LOGGER.log(Level.WARNING, "Discarding connection accepted on " + boundEndpoint
                    + ": socket could not be configured", e);
            return null;
        }
    }

    @Override
    protected void closeListener(ServerSocketChannel listener, Endpoint boundEndpoint) {
        try {
            listener.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close listener on " + boundEndpoint, e);
        }
    }
}
