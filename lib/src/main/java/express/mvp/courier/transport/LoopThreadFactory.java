package express.mvp.courier.transport;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for the dedicated loop threads.
 *
 * <p>Every accept loop and every receive loop runs on its own platform thread. Threads are named
 * {@code {prefix}-{counter}} so they are easy to spot in thread dumps, and are daemon threads by
 * default so a forgotten loop never keeps the JVM alive.
 *
 * <table border="1">
 *   <caption>Shared factories</caption>
 *   <tr><th>Factory</th><th>Thread names</th><th>Used by</th></tr>
 *   <tr><td>{@link #ACCEPT}</td><td>courier-accept-N</td><td>accept loops</td></tr>
 *   <tr><td>{@link #RECEIVE}</td><td>courier-receive-N</td><td>{@link MessageReceiveLoop}</td></tr>
 * </table>
 *
 * <p>This class is thread-safe.
 */
public final class LoopThreadFactory implements ThreadFactory {

    /** Factory for accept loop threads. */
    public static final LoopThreadFactory ACCEPT = new LoopThreadFactory("courier-accept");

    /** Factory for receive loop threads. */
    public static final LoopThreadFactory RECEIVE = new LoopThreadFactory("courier-receive");

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;
    private final boolean daemon;

    /**
     * Creates a factory producing daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public LoopThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public LoopThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates a new, unstarted thread.
     *
     * @param runnable the loop body
     * @return the thread
     */
    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }

    public long getThreadCount() {
        return threadCount.get();
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    @Override
    public String toString() {
        return "LoopThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
