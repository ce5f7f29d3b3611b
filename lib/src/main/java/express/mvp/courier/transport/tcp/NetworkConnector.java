package express.mvp.courier.transport.tcp;

import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.SocketConnector;
import express.mvp.courier.transport.TransportConfigurationException;
import express.mvp.courier.transport.TransportException;
import express.mvp.courier.transport.TransportKind;
import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.Objects;

/**
 * Opens outgoing TCP connections.
 *
 * <p>The connect itself honours {@link SocketConfiguration#getConnectTimeout()}. The resulting
 * connection gets the same options an accepted one would; whether the receive timeout applies is
 * decided by the node type this connector was created with.
 */
public final class NetworkConnector implements SocketConnector {

    private final NodeType nodeType;

    /** Creates a connector for {@link NodeType#REQUESTER} connections. */
    public NetworkConnector() {
        this(NodeType.REQUESTER);
    }

    public NetworkConnector(NodeType nodeType) {
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
    }

    @Override
    public Connection connect(Endpoint endpoint, SocketConfiguration socketConfiguration) {
        TransportConfigurationException.requireKind(endpoint, TransportKind.NETWORK);
        Objects.requireNonNull(socketConfiguration, "socketConfiguration");

        SocketChannel channel = null;
        try {
            channel = SocketChannel.open();
            long timeout = SocketConfiguration.toMillisOrZero(socketConfiguration.getConnectTimeout());
            channel.socket().connect(
                    HostResolver.resolveRemote(endpoint), (int) Math.min(timeout, Integer.MAX_VALUE));
            return NetworkConnection.open(channel, endpoint, nodeType, socketConfiguration);
        } catch (IOException e) {
            TransportException failure = new TransportException("Failed to connect to " + endpoint, e);
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
            throw failure;
        }
    }

    public NodeType getNodeType() {
        return nodeType;
    }
}
