package express.mvp.courier.transport;

import express.mvp.courier.transport.error.FailureCategory;
import express.mvp.courier.transport.error.FailureClassifier;
import express.mvp.courier.transport.framing.Frame;
import express.mvp.courier.transport.framing.FrameCodec;
import express.mvp.courier.transport.framing.FrameReceiver;
import express.mvp.courier.transport.lifecycle.LoopState;
import express.mvp.courier.transport.lifecycle.LoopStateListener;
import express.mvp.courier.transport.lifecycle.LoopStateMachine;
import express.mvp.courier.transport.serialization.Message;
import express.mvp.courier.transport.serialization.SerializationException;
import express.mvp.courier.transport.serialization.SerializationRegistry;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads frames from one connection on a dedicated thread and dispatches the decoded messages.
 *
 * <p>The loop borrows the connection; it never closes it. Frames are dispatched strictly in
 * arrival order by the single loop thread.
 *
 * <h2>Start and Stop Barriers</h2>
 *
 * <ul>
 *   <li>{@link #start()} returns only once the loop thread is {@link LoopState#RUNNING}
 *   <li>{@link #stop(boolean) stop(true)} returns only once the loop thread has exited, so no
 *       message handler call happens after it returns
 * </ul>
 *
 * <p>Stopping interrupts the loop thread, which unblocks a pending read without closing the
 * connection. A handler running at that moment sees its thread interrupted. A loop can be started
 * again after it stopped and continues exactly where the stream was left: partially read frames
 * and a frame that was read but not yet dispatched are kept.
 *
 * <h2>Failure Handling</h2>
 *
 * <table border="1">
 *   <caption>Loop reaction per failure</caption>
 *   <tr><th>Failure</th><th>Socket-exception handler</th><th>Loop</th></tr>
 *   <tr><td>End of stream, cancellation</td><td>-</td><td>exits</td></tr>
 *   <tr><td>Unknown type id, malformed payload</td><td>called</td><td>continues</td></tr>
 *   <tr><td>I/O error, invalid frame header</td><td>called once</td><td>exits</td></tr>
 *   <tr><td>Message handler threw</td><td>- (logged)</td><td>continues</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MessageReceiveLoop loop = new MessageReceiveLoop(
 *     connection,
 *     registry,
 *     (conn, message) -> process(message),
 *     (conn, error) -> LOGGER.log(Level.WARNING, "Receive failed", error));
 *
 * loop.start();   // returns once frames are being consumed
 * // ...
 * loop.stop();    // returns once no more messages will be dispatched
 * }</pre>
 */
public final class MessageReceiveLoop implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MessageReceiveLoop.class.getName());

    private final Connection connection;
    private final SerializationRegistry registry;
    private final MessageReceivedHandler messageHandler;
    private final SocketExceptionHandler exceptionHandler;
    private final ThreadFactory threadFactory;
    private final FrameReceiver frameReceiver;
    private final LoopStateMachine stateMachine;

    private final Object lifecycleLock = new Object();
    private final Object closeLock = new Object();

    /** Guarded by {@link #closeLock}. */
    private boolean closed;

    /** Guarded by {@link #lifecycleLock}. */
    private Thread loopThread;

    /** Guarded by {@link #lifecycleLock}; released while no loop thread exists. */
    private CountDownLatch exited = new CountDownLatch(0);

    private volatile boolean cancelled;

    /** Read but not dispatched when the loop was cancelled. Loop thread only. */
    private Frame undelivered;

    /**
     * Creates a loop with the default frame limits and thread factory.
     *
     * @param connection the connection to read
     * @param registry resolves frame payloads to messages
     * @param messageHandler receives each message
     * @param exceptionHandler receives reported failures
     */
    public MessageReceiveLoop(
            Connection connection,
            SerializationRegistry registry,
            MessageReceivedHandler messageHandler,
            SocketExceptionHandler exceptionHandler) {
        this(connection, registry, messageHandler, exceptionHandler,
                FrameCodec.defaultCodec(), LoopThreadFactory.RECEIVE);
    }

    /**
     * Creates a loop.
     *
     * @param connection the connection to read
     * @param registry resolves frame payloads to messages
     * @param messageHandler receives each message
     * @param exceptionHandler receives reported failures
     * @param codec frame limits
     * @param threadFactory source of the loop thread
     */
    public MessageReceiveLoop(
            Connection connection,
            SerializationRegistry registry,
            MessageReceivedHandler messageHandler,
            SocketExceptionHandler exceptionHandler,
            FrameCodec codec,
            ThreadFactory threadFactory) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler");
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.frameReceiver = new FrameReceiver(connection, codec);
        this.stateMachine = new LoopStateMachine("receive " + connection.getEndpoint());
    }

    /**
     * Starts the loop thread and waits until it is running.
     *
     * <p>Does nothing if the loop is already running.
     *
     * @throws IllegalStateException if the loop is starting, stopping or closed
     * @throws TransportException if the thread cannot be started
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (isClosed()) {
                throw new IllegalStateException("Receive loop is closed: " + connection.getEndpoint());
            }
            if (stateMachine.getState() == LoopState.RUNNING) {
                return;
            }
            if (!stateMachine.transitionFrom(LoopState.IDLE, LoopState.STARTING)) {
                throw new IllegalStateException(
                        "Cannot start receive loop in state " + stateMachine.getState());
            }

            cancelled = false;
            CountDownLatch running = new CountDownLatch(1);
            CountDownLatch loopExited = new CountDownLatch(1);
            Thread thread;
            try {
                thread = threadFactory.newThread(() -> run(running, loopExited));
                loopThread = thread;
                exited = loopExited;
                thread.start();
            } catch (RuntimeException | Error e) {
                loopThread = null;
                loopExited.countDown();
                stateMachine.transitionTo(LoopState.IDLE);
                throw new TransportException(
                        "Failed to start receive loop for " + connection.getEndpoint(), e);
            }
            awaitUninterruptibly(running);
        }
    }

    /** Stops the loop and waits for its thread to exit. */
    public void stop() {
        stop(true);
    }

    /**
     * Signals cancellation and optionally waits for the loop thread to exit.
     *
     * <p>Waiting is skipped when called from the loop thread itself, for example from a handler.
     *
     * @param waitForExit whether to block until the loop is {@link LoopState#IDLE}
     */
    public void stop(boolean waitForExit) {
        Thread thread;
        CountDownLatch loopExited;
        synchronized (lifecycleLock) {
            thread = loopThread;
            loopExited = exited;
            if (thread == null) {
                return;
            }
            cancelled = true;
            stateMachine.transitionFrom(LoopState.RUNNING, LoopState.STOPPING);
            thread.interrupt();
        }

        if (waitForExit && Thread.currentThread() != thread) {
            try {
                loopExited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Shuts down the connection's input and stops the loop without waiting. Idempotent.
     *
     * <p>Not waiting keeps {@code close()} safe to call from the loop's own handlers.
     */
    @Override
    public void close() {
        synchronized (closeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        connection.shutdownInput();
        stop(false);
    }

    public LoopState getState() {
        return stateMachine.getState();
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isClosed() {
        synchronized (closeLock) {
            return closed;
        }
    }

    public void addStateListener(LoopStateListener listener) {
        stateMachine.addListener(listener);
    }

    private void run(CountDownLatch running, CountDownLatch loopExited) {
        try {
            stateMachine.transitionTo(LoopState.RUNNING);
            running.countDown();
            receiveFrames();
        } catch (RuntimeException | Error e) {
            LOGGER.log(Level.SEVERE, "Receive loop for " + connection.getEndpoint() + " failed", e);
            throw e;
        } finally {
            running.countDown();
            synchronized (lifecycleLock) {
                if (loopThread == Thread.currentThread()) {
                    loopThread = null;
                }
                stateMachine.transitionTo(LoopState.IDLE);
            }
            loopExited.countDown();
        }
    }

    private void receiveFrames() {
        while (!cancelled) {
            Frame frame = undelivered;
            undelivered = null;
            if (frame == null) {
                try {
                    frame = frameReceiver.receive();
                } catch (IOException | TransportException e) {
                    FailureCategory category =
                            cancelled ? FailureCategory.SHUTDOWN : FailureClassifier.classify(e);
                    if (category.isReported()) {
                        report(e);
                    }
                    if (category.terminatesLoop()) {
                        return;
                    }
                    continue;
                }
            }

            if (cancelled) {
                undelivered = frame;
                return;
            }
            dispatch(frame);
        }
    }

    private void dispatch(Frame frame) {
        Message message;
        try {
            message = registry.deserialize(frame.typeId(), frame.payload());
        } catch (SerializationException e) {
            report(e);
            return;
        }

        try {
            messageHandler.onMessageReceived(connection, message);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Message handler failed for type id " + frame.typeId()
                    + " on " + connection.getEndpoint(), e);
        }
    }

    private void report(Throwable error) {
        try {
            exceptionHandler.onSocketException(connection, error);
        } catch (Exception e) {
            e.addSuppressed(error);
            LOGGER.log(Level.WARNING,
                    "Socket exception handler failed on " + connection.getEndpoint(), e);
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "MessageReceiveLoop[" + connection.getEndpoint() + ", " + stateMachine.getState() + "]";
    }
}
