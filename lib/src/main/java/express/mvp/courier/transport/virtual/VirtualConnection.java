package express.mvp.courier.transport.virtual;

import express.mvp.courier.transport.AbstractConnection;
import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.OperationCancelledException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One end of an in-memory duplex byte stream.
 *
 * <p>Ends are always created in pairs by {@link #createPair(Endpoint)}. Bytes written to one end
 * are read from the other in write order, with nothing lost or duplicated.
 *
 * <h2>Closing</h2>
 *
 * <table border="1">
 *   <caption>Effect of closing one end</caption>
 *   <tr><th>Operation</th><th>On this end</th><th>On the peer</th></tr>
 *   <tr><td>{@link #close()}</td><td>reads return -1, writes fail</td>
 *       <td>drains written bytes, then reads -1; writes fail</td></tr>
 *   <tr><td>{@link #shutdownInput()}</td><td>reads return -1</td><td>writes fail</td></tr>
 * </table>
 *
 * <p>A blocked read is cancelled by interrupting the reading thread, which raises
 * {@link OperationCancelledException} without closing anything.
 */
public final class VirtualConnection extends AbstractConnection {

    private final BlockingByteQueue inbound;
    private final BlockingByteQueue outbound;
    private final AtomicBoolean closed = new AtomicBoolean();

    private VirtualConnection(Endpoint endpoint, BlockingByteQueue inbound, BlockingByteQueue outbound) {
        super(endpoint);
        this.inbound = inbound;
        this.outbound = outbound;
    }

    /**
     * Creates two connected ends.
     *
     * @param endpoint the virtual endpoint both ends report
     * @return the connected pair
     */
    public static Pair createPair(Endpoint endpoint) {
        BlockingByteQueue connectorToAccepter = new BlockingByteQueue();
        BlockingByteQueue accepterToConnector = new BlockingByteQueue();
        return new Pair(
                new VirtualConnection(endpoint, accepterToConnector, connectorToAccepter),
                new VirtualConnection(endpoint, connectorToAccepter, accepterToConnector));
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws OperationCancelledException {
        checkBounds(buffer, offset, length);
        int read = inbound.read(buffer, offset, length);
        if (read < 0) {
            fireDisconnected();
        }
        return read;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws ConnectionClosedException {
        checkBounds(buffer, offset, length);
        if (closed.get()) {
            throw new ConnectionClosedException("Connection is closed: " + getEndpoint());
        }
        outbound.write(buffer, offset, length);
    }

    @Override
    public void shutdownInput() {
        inbound.abort();
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && !isDisconnected() && !outbound.isAborted();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        inbound.abort();
        outbound.finish();
        fireDisconnected();
    }

    @Override
    public String toString() {
        return "VirtualConnection[" + getEndpoint() + (closed.get() ? ", closed]" : "]");
    }

    /**
     * The two ends of a new virtual connection.
     *
     * @param connectorEnd end returned to the connecting side
     * @param accepterEnd end handed to the accepter
     */
    public record Pair(VirtualConnection connectorEnd, VirtualConnection accepterEnd) {}
}
