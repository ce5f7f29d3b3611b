package express.mvp.courier.transport.tcp;

import express.mvp.courier.transport.AbstractConnection;
import express.mvp.courier.transport.ConnectionClosedException;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.OperationCancelledException;
import express.mvp.courier.transport.SocketConfiguration;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link express.mvp.courier.transport.Connection} over a TCP socket.
 *
 * <p>The socket channel runs in non-blocking mode with one selector per direction. Blocking reads
 * and writes wait in {@link Selector#select(long)}, which gives the connection three properties a
 * plain blocking socket lacks:
 *
 * <ul>
 *   <li><b>Cancellation:</b> interrupting a blocked thread wakes its selector and the call fails
 *       with {@link OperationCancelledException}, leaving the socket open
 *   <li><b>Timeouts:</b> send and receive timeouts are select timeouts and fail with
 *       {@link SocketTimeoutException}
 *   <li><b>Prompt close:</b> {@link #close()} wakes both selectors
 * </ul>
 *
 * <h2>Socket Options</h2>
 *
 * <table border="1">
 *   <caption>Options applied by {@link #open}</caption>
 *   <tr><th>Option</th><th>Value</th></tr>
 *   <tr><td>TCP_NODELAY</td><td>true</td></tr>
 *   <tr><td>SO_SNDBUF / SO_RCVBUF</td><td>configured buffer sizes</td></tr>
 *   <tr><td>Send timeout</td><td>configured, 0 = none</td></tr>
 *   <tr><td>Receive timeout</td>
 *       <td>configured when {@link NodeType#hasReceiveTimeout()}, else none</td></tr>
 * </table>
 *
 * <p>{@link #getSendBufferSize()} and {@link #getReceiveBufferSize()} report the configured sizes.
 * The kernel may round the real buffers (Linux doubles them), which is not what callers asked for.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Reads are serialized with each other and writes with each other; one reader and any number of
 * writers may use the connection concurrently. A write interrupted or timed out after a partial
 * transfer leaves the stream unusable.
 */
public final class NetworkConnection extends AbstractConnection {

    private static final Logger LOGGER = Logger.getLogger(NetworkConnection.class.getName());

    private final SocketChannel channel;
    private final Selector readSelector;
    private final Selector writeSelector;

    private final Object readLock = new Object();
    private final Object writeLock = new Object();

    private final int sendBufferSize;
    private final int receiveBufferSize;
    private final long sendTimeoutMillis;
    private final long receiveTimeoutMillis;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean inputShutdown;

    private NetworkConnection(
            SocketChannel channel,
            Endpoint endpoint,
            SocketConfiguration configuration,
            long receiveTimeoutMillis)
            throws IOException {
        super(endpoint);
        this.channel = channel;
        this.sendBufferSize = configuration.getSendBufferSize();
        this.receiveBufferSize = configuration.getReceiveBufferSize();
        this.sendTimeoutMillis = SocketConfiguration.toMillisOrZero(configuration.getSendTimeout());
        this.receiveTimeoutMillis = receiveTimeoutMillis;

        Selector reads = Selector.open();
        try {
            Selector writes = Selector.open();
            try {
                channel.register(reads, SelectionKey.OP_READ);
                channel.register(writes, SelectionKey.OP_WRITE);
            } catch (IOException e) {
                writes.close();
                throw e;
            }
            this.writeSelector = writes;
        } catch (IOException e) {
            reads.close();
            throw e;
        }
        this.readSelector = reads;
    }

    /**
     * Applies socket options to a connected channel and wraps it.
     *
     * <p>On failure the channel is left open; the caller closes it.
     *
     * @param channel a connected socket channel
     * @param endpoint the endpoint the connection belongs to
     * @param nodeType decides whether the receive timeout applies
     * @param configuration buffer sizes and timeouts
     * @return the connection
     * @throws IOException if an option cannot be applied
     */
    public static NetworkConnection open(
            SocketChannel channel,
            Endpoint endpoint,
            NodeType nodeType,
            SocketConfiguration configuration)
            throws IOException {
        channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
        channel.setOption(StandardSocketOptions.SO_SNDBUF, configuration.getSendBufferSize());
        channel.setOption(StandardSocketOptions.SO_RCVBUF, configuration.getReceiveBufferSize());
        channel.configureBlocking(false);

        long receiveTimeout = nodeType.hasReceiveTimeout()
                ? SocketConfiguration.toMillisOrZero(configuration.getReceiveTimeout())
                : 0;
        return new NetworkConnection(channel, endpoint, configuration, receiveTimeout);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        checkBounds(buffer, offset, length);
        if (length == 0) {
            return 0;
        }
        synchronized (readLock) {
            ByteBuffer target = ByteBuffer.wrap(buffer, offset, length);
            long deadline = deadline(receiveTimeoutMillis);
            while (true) {
                if (inputShutdown) {
                    fireDisconnected();
                    return -1;
                }
                int read;
                try {
                    read = channel.read(target);
                } catch (ClosedChannelException e) {
                    throw closedDuring("read", e);
                } catch (IOException e) {
                    fireDisconnected();
                    throw e;
                }
                if (read < 0) {
                    fireDisconnected();
                    return -1;
                }
                if (read > 0) {
                    return read;
                }
                await(readSelector, deadline, "read");
            }
        }
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        checkBounds(buffer, offset, length);
        synchronized (writeLock) {
            if (closed.get()) {
                throw new ConnectionClosedException("Connection is closed: " + getEndpoint());
            }
            ByteBuffer source = ByteBuffer.wrap(buffer, offset, length);
            long deadline = deadline(sendTimeoutMillis);
            while (source.hasRemaining()) {
                int written;
                try {
                    written = channel.write(source);
                } catch (ClosedChannelException e) {
                    throw closedDuring("write", e);
                } catch (IOException e) {
                    fireDisconnected();
                    throw e;
                }
                if (written == 0) {
                    await(writeSelector, deadline, "write");
                }
            }
        }
    }

    /** Waits for readiness; returns on readiness or spurious wakeup. */
    private void await(Selector selector, long deadline, String operation) throws IOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Cancelled " + operation + " on " + getEndpoint());
        }
        long timeout = 0;
        if (deadline != 0) {
            timeout = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (timeout <= 0) {
                throw new SocketTimeoutException(
                        "Timed out waiting to " + operation + " on " + getEndpoint());
            }
        }
        try {
            selector.select(timeout);
            selector.selectedKeys().clear();
        } catch (ClosedSelectorException e) {
            throw closedDuring(operation, e);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Cancelled " + operation + " on " + getEndpoint());
        }
        if (closed.get()) {
            throw closedDuring(operation, null);
        }
    }

    private static long deadline(long timeoutMillis) {
        return timeoutMillis > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis) : 0;
    }

    private ConnectionClosedException closedDuring(String operation, Throwable cause) {
        fireDisconnected();
        return new ConnectionClosedException(
                "Connection closed during " + operation + ": " + getEndpoint(), cause);
    }

    @Override
    public void shutdownInput() {
        inputShutdown = true;
        try {
            channel.shutdownInput();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "shutdownInput failed on " + getEndpoint(), e);
        }
        readSelector.wakeup();
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && !isDisconnected() && channel.isConnected();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        // Channel first; closing the selectors then deregisters it and releases the socket
        closeQuietly(channel);
        closeQuietly(readSelector);
        closeQuietly(writeSelector);
        fireDisconnected();
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Close failed on " + getEndpoint(), e);
        }
    }

    public int getSendBufferSize() {
        return sendBufferSize;
    }

    public int getReceiveBufferSize() {
        return receiveBufferSize;
    }

    public long getSendTimeoutMillis() {
        return sendTimeoutMillis;
    }

    /**
     * Returns the effective receive timeout; 0 when none applies to this node type.
     *
     * @return timeout in milliseconds
     */
    public long getReceiveTimeoutMillis() {
        return receiveTimeoutMillis;
    }

    /**
     * Reads TCP_NODELAY from the socket.
     *
     * @return true if send coalescing is disabled
     * @throws IOException if the option cannot be read, for example after close
     */
    public boolean isNoDelay() throws IOException {
        return channel.getOption(StandardSocketOptions.TCP_NODELAY);
    }

    /**
     * Returns the peer address.
     *
     * @return the remote address
     * @throws IOException if the socket is closed
     */
    public SocketAddress getRemoteAddress() throws IOException {
        return channel.getRemoteAddress();
    }

    @Override
    public String toString() {
        return "NetworkConnection[" + getEndpoint() + (closed.get() ? ", closed]" : "]");
    }
}
