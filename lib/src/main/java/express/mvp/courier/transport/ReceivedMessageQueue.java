package express.mvp.courier.transport;

import express.mvp.courier.transport.serialization.Message;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link MessageReceivedHandler} that hands messages to consumer threads through a queue.
 *
 * <p>The receive loop only enqueues, so a slow consumer never holds up the loop. With a bounded
 * capacity, messages arriving while the queue is full are dropped and counted rather than
 * blocking the loop.
 *
 * <pre>{@code
 * ReceivedMessageQueue inbox = new ReceivedMessageQueue();
 * MessageReceiveLoop loop = new MessageReceiveLoop(connection, registry, inbox, errors);
 * loop.start();
 *
 * ReceivedMessage next = inbox.poll(Duration.ofSeconds(1));
 * }</pre>
 */
public final class ReceivedMessageQueue implements MessageReceivedHandler {

    private static final Logger LOGGER = Logger.getLogger(ReceivedMessageQueue.class.getName());

    private final BlockingQueue<ReceivedMessage> queue;
    private final AtomicLong dropped = new AtomicLong();

    /** Creates an unbounded queue. */
    public ReceivedMessageQueue() {
        this.queue = new LinkedBlockingQueue<>();
    }

    /**
     * Creates a bounded queue.
     *
     * @param capacity maximum number of queued messages
     */
    public ReceivedMessageQueue(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public void onMessageReceived(Connection connection, Message message) {
        if (!queue.offer(new ReceivedMessage(connection, message))) {
            long total = dropped.incrementAndGet();
            LOGGER.log(Level.WARNING, "Queue full, dropped message type id {0} from {1} ({2} dropped)",
                    new Object[] {message.getMessageTypeId(), connection.getEndpoint(), total});
        }
    }

    /**
     * Waits for the next message.
     *
     * @return the next message
     * @throws InterruptedException if interrupted while waiting
     */
    public ReceivedMessage take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @param timeout maximum wait
     * @return the next message, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public ReceivedMessage poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int drainTo(Collection<? super ReceivedMessage> target) {
        return queue.drainTo(target);
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
