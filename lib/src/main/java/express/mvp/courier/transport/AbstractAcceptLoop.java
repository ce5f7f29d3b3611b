package express.mvp.courier.transport;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.courier.transport.TransportConfigurationException.Reason;
import express.mvp.courier.transport.error.FailureClassifier;
import express.mvp.courier.transport.error.RetryPolicy;
import express.mvp.courier.transport.lifecycle.LoopState;
import express.mvp.courier.transport.lifecycle.LoopStateListener;
import express.mvp.courier.transport.lifecycle.LoopStateMachine;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bind/unbind lifecycle and accept loop shared by every {@link SocketAccepter}.
 *
 * <p>Subclasses supply the transport-specific pieces: opening the listener, blocking for the next
 * connection and closing the listener. This class owns the thread, the state machine, the
 * listener hand-off and the isolation of application callbacks.
 *
 * <h2>State Transitions</h2>
 *
 * <pre>
 *  bind()                      unbind()                  loop exited
 * IDLE ──► STARTING ──► RUNNING ──► STOPPING ──────────────► IDLE
 *              │            │                                 ▲
 *              │ open failed└──── listener closed elsewhere ───┤
 *              └───────────────────────────────────────────────┘
 * </pre>
 *
 * <p>{@link #bind} is only accepted in {@link LoopState#IDLE}; a bind issued after
 * {@code unbind(false)} but before the old loop has exited fails with
 * {@link Reason#ALREADY_BOUND}.
 *
 * <h2>Listener Hand-off</h2>
 *
 * <p>The current listener lives in an {@link AtomicReference}. {@link #unbind(boolean)} takes it
 * with {@code getAndSet(null)}, so exactly one caller tears it down and later calls are no-ops.
 *
 * <h2>Accept Failures</h2>
 *
 * <table border="1">
 *   <caption>How the loop reacts to accept failures</caption>
 *   <tr><th>Failure</th><th>Reaction</th></tr>
 *   <tr><td>Cancellation, listener closed</td><td>Exit quietly</td></tr>
 *   <tr><td>Other {@link IOException}</td><td>Log, back off per {@link RetryPolicy}, retry</td></tr>
 *   <tr><td>Handler threw</td><td>Log, keep accepting</td></tr>
 * </table>
 *
 * @param <L> the listener type (a server channel, a pending-connection queue)
 */
public abstract class AbstractAcceptLoop<L> implements SocketAccepter {

    private static final Logger LOGGER = Logger.getLogger(AbstractAcceptLoop.class.getName());

    private final LoopStateMachine stateMachine;
    private final ThreadFactory threadFactory;
    private final RetryPolicy retryPolicy;

    private final Object bindLock = new Object();

    private final AtomicReference<Binding<L>> current = new AtomicReference<>();

    /**
     * Creates an accept loop.
     *
     * @param loopName name used in log messages
     * @param threadFactory source of the accept thread
     * @param retryPolicy pacing for transient accept failures
     */
    protected AbstractAcceptLoop(String loopName, ThreadFactory threadFactory, RetryPolicy retryPolicy) {
        this.stateMachine = new LoopStateMachine(loopName);
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    /**
     * Checks that the endpoint belongs to this accepter's transport.
     *
     * @param endpoint the requested endpoint
     * @throws TransportConfigurationException {@code INVALID_TRANSPORT} on mismatch
     */
    protected abstract void checkEndpoint(Endpoint endpoint);

    /**
     * Opens the listener synchronously. When this returns, peers can connect.
     *
     * @param endpoint the requested endpoint
     * @return the listener
     * @throws TransportException if the endpoint cannot be bound
     */
    protected abstract L openListener(Endpoint endpoint);

    /**
     * Returns the endpoint the listener is actually bound to.
     *
     * @param listener the open listener
     * @param requested the endpoint passed to bind
     * @return the bound endpoint
     */
    protected abstract Endpoint boundEndpoint(L listener, Endpoint requested);

    /**
     * Blocks until the next connection arrives and configures it.
     *
     * @param listener the open listener
     * @param boundEndpoint the bound endpoint
     * @param nodeType node type policy for socket options
     * @param socketConfiguration options to apply
     * @return the connection, or null if the accepted connection could not be configured and was
     *     discarded
     * @throws IOException if accepting fails, including cancellation and listener closure
     */
    protected abstract Connection accept(
            L listener,
            Endpoint boundEndpoint,
            NodeType nodeType,
            SocketConfiguration socketConfiguration)
            throws IOException;

    /**
     * Closes the listener, unblocking a pending {@link #accept}. Must be idempotent.
     *
     * @param listener the listener
     * @param boundEndpoint the bound endpoint
     */
    protected abstract void closeListener(L listener, Endpoint boundEndpoint);

    @Override
    public void bind(
            Endpoint endpoint,
            NodeType nodeType,
            SocketConfiguration socketConfiguration,
            ClientConnectedHandler onConnected,
            ClientDisconnectedHandler onDisconnected) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(nodeType, "nodeType");
        Objects.requireNonNull(socketConfiguration, "socketConfiguration");
        Objects.requireNonNull(onConnected, "onConnected");
        Objects.requireNonNull(onDisconnected, "onDisconnected");
        checkEndpoint(endpoint);

        synchronized (bindLock) {
            if (!stateMachine.transitionFrom(LoopState.IDLE, LoopState.STARTING)) {
                throw new TransportConfigurationException(Reason.ALREADY_BOUND,
                        "Accepter is still bound to " + getBoundEndpoint()
                                + " (state " + stateMachine.getState() + ")");
            }

            L listener;
            try {
                listener = openListener(endpoint);
            } catch (RuntimeException e) {
                stateMachine.transitionTo(LoopState.IDLE);
                throw e;
            }

            Endpoint bound;
            try {
                bound = boundEndpoint(listener, endpoint);
            } catch (RuntimeException e) {
                closeListener(listener, endpoint);
                stateMachine.transitionTo(LoopState.IDLE);
                throw e;
            }

            Binding<L> binding = new Binding<>(listener, bound,
                    nodeType, socketConfiguration, onConnected, onDisconnected);
            try {
                binding.thread = threadFactory.newThread(() -> runLoop(binding));
            } catch (RuntimeException e) {
                closeListener(listener, binding.endpoint);
                stateMachine.transitionTo(LoopState.IDLE);
                throw new TransportException("Failed to create accept thread for " + endpoint, e);
            }
            current.set(binding);
            stateMachine.transitionTo(LoopState.RUNNING);
            binding.thread.start();
        }
    }

    @Override
    public void unbind(boolean waitForExit) {
        Binding<L> binding = current.getAndSet(null);
        if (binding == null) {
            return;
        }
        stateMachine.transitionFrom(LoopState.RUNNING, LoopState.STOPPING);
        binding.cancelled = true;
        closeListener(binding.listener, binding.endpoint);
        binding.thread.interrupt();

        if (waitForExit && Thread.currentThread() != binding.thread) {
            try {
                binding.exited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public Endpoint getBoundEndpoint() {
        Binding<L> binding = current.get();
        return binding == null ? null : binding.endpoint;
    }

    @Override
    public boolean isBound() {
        return current.get() != null;
    }

    public LoopState getState() {
        return stateMachine.getState();
    }

    public void addStateListener(LoopStateListener listener) {
        stateMachine.addListener(listener);
    }

    private void runLoop(Binding<L> binding) {
        int consecutiveFailures = 0;
        try {
            while (!binding.cancelled) {
                Connection connection;
                try {
                    connection = accept(binding.listener, binding.endpoint,
                            binding.nodeType, binding.socketConfiguration);
                    consecutiveFailures = 0;
                } catch (IOException e) {
                    if (binding.cancelled || FailureClassifier.isShutdown(e)) {
                        break;
                    }
                    long delay = retryPolicy.delayMillis(++consecutiveFailures);
                    LOGGER.log(Level.WARNING, "Accept failed on " + binding.endpoint
                            + ", retrying in " + delay + "ms (attempt " + consecutiveFailures + ")", e);
                    if (!pause(delay)) {
                        break;
                    }
                    continue;
                }

                if (connection == null) {
                    continue;
                }
                if (binding.cancelled) {
                    connection.close();
                    break;
                }
                handOff(binding, connection);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Accept loop on " + binding.endpoint + " terminated", e);
        } finally {
            if (current.compareAndSet(binding, null)) {
                // Exited on its own; nobody else will close the listener
                closeListener(binding.listener, binding.endpoint);
            }
            stateMachine.transitionTo(LoopState.IDLE);
            binding.exited.countDown();
        }
    }

    private void handOff(Binding<L> binding, Connection connection) {
        try {
            binding.onConnected.onClientConnected(connection, binding.socketConfiguration);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Client connected handler failed for " + binding.endpoint, e);
        }
        connection.addDisconnectListener(disconnected -> {
            try {
                binding.onDisconnected.onClientDisconnected(disconnected);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING,
                        "Client disconnected handler failed for " + binding.endpoint, e);
            }
        });
    }

    private static boolean pause(long delayMillis) {
        try {
            Thread.sleep(delayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + stateMachine.getState()
                + ", endpoint=" + getBoundEndpoint() + "]";
    }

    /** Everything one bind call owns. */
    private static final class Binding<L> {
        final L listener;
        final Endpoint endpoint;
        final NodeType nodeType;
        final SocketConfiguration socketConfiguration;
        final ClientConnectedHandler onConnected;
        final ClientDisconnectedHandler onDisconnected;
        final CountDownLatch exited = new CountDownLatch(1);

        @SuppressFBWarnings(
                value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
                justification = "Written once under bindLock before the thread starts.")
        Thread thread;

        volatile boolean cancelled;

        Binding(
                L listener,
                Endpoint endpoint,
                NodeType nodeType,
                SocketConfiguration socketConfiguration,
                ClientConnectedHandler onConnected,
                ClientDisconnectedHandler onDisconnected) {
            this.listener = listener;
            this.endpoint = endpoint;
            this.nodeType = nodeType;
            this.socketConfiguration = socketConfiguration;
            this.onConnected = onConnected;
            this.onDisconnected = onDisconnected;
        }
    }
}
