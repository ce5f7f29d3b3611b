package express.mvp.courier.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class holding the endpoint and the one-shot disconnected notification.
 *
 * <p>Subclasses call {@link #fireDisconnected()} whenever they observe end of stream, a fatal I/O
 * error or a close. Only the first call has an effect; listeners registered afterwards are invoked
 * immediately, so no listener misses the notification and none sees it twice.
 */
public abstract class AbstractConnection implements Connection {

    private static final Logger LOGGER = Logger.getLogger(AbstractConnection.class.getName());

    private final Endpoint endpoint;

    private final Object disconnectLock = new Object();

    /** Guarded by {@link #disconnectLock}. */
    private final List<DisconnectListener> listeners = new ArrayList<>();

    /** Guarded by {@link #disconnectLock}. */
    private boolean disconnected;

    protected AbstractConnection(Endpoint endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    @Override
    public Endpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public void addDisconnectListener(DisconnectListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (disconnectLock) {
            if (!disconnected) {
                listeners.add(listener);
                return;
            }
        }
        notifyListener(listener);
    }

    /**
     * Checks whether the disconnected notification has fired.
     *
     * @return true once disconnected
     */
    protected boolean isDisconnected() {
        synchronized (disconnectLock) {
            return disconnected;
        }
    }

    /**
     * Fires the disconnected notification if it has not fired yet.
     *
     * @return true if this call fired it
     */
    protected boolean fireDisconnected() {
        List<DisconnectListener> snapshot;
        synchronized (disconnectLock) {
            if (disconnected) {
                return false;
            }
            disconnected = true;
            snapshot = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (DisconnectListener listener : snapshot) {
            notifyListener(listener);
        }
        return true;
    }

    private void notifyListener(DisconnectListener listener) {
        try {
            listener.onDisconnected(this);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Disconnect listener failed for " + endpoint, e);
        }
    }

    /** Validates array bounds the way {@link java.io.InputStream#read(byte[], int, int)} does. */
    protected static void checkBounds(byte[] buffer, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, Objects.requireNonNull(buffer, "buffer").length);
    }
}
