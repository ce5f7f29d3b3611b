package express.mvp.courier.transport.error;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff schedule for retrying a failed operation.
 *
 * <p>The accept loops use this to pace retries after transient accept failures (for example
 * running out of file descriptors) instead of spinning or giving up. The delay doubles with each
 * consecutive failure up to a cap; the caller resets its failure count after a success.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.exponentialBackoff(
 *     Duration.ofMillis(10),
 *     Duration.ofSeconds(1));
 *
 * int failures = 0;
 * while (running) {
 *     try {
 *         accept();
 *         failures = 0;
 *     } catch (IOException e) {
 *         Thread.sleep(policy.delayMillis(++failures));
 *     }
 * }
 * }</pre>
 */
public final class RetryPolicy {

    /** Initial delay for the first retry. */
    private final long initialDelayMillis;

    /** Maximum delay cap. */
    private final long maxDelayMillis;

    private RetryPolicy(long initialDelayMillis, long maxDelayMillis) {
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
    }

    /**
     * Calculates the delay before the next retry.
     *
     * @param consecutiveFailures number of failures in a row, starting at 1
     * @return delay in milliseconds, never negative
     */
    public long delayMillis(int consecutiveFailures) {
        int retryNumber = Math.max(0, consecutiveFailures - 1);
        // Past 62 doublings every delay is capped anyway
        if (retryNumber >= 62 || initialDelayMillis > (maxDelayMillis >> retryNumber)) {
            return maxDelayMillis;
        }
        return Math.min(initialDelayMillis << retryNumber, maxDelayMillis);
    }

    public long getInitialDelayMillis() {
        return initialDelayMillis;
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    /**
     * Returns a policy with exponential backoff.
     *
     * @param initialDelay initial delay
     * @param maxDelay maximum delay cap
     * @return exponential backoff policy
     * @throws IllegalArgumentException if a delay is negative or the cap is below the initial delay
     */
    public static RetryPolicy exponentialBackoff(Duration initialDelay, Duration maxDelay) {
        long initial = Objects.requireNonNull(initialDelay, "initialDelay").toMillis();
        long max = Objects.requireNonNull(maxDelay, "maxDelay").toMillis();
        if (initial < 0 || max < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (max < initial) {
            throw new IllegalArgumentException(
                    "maxDelay " + max + "ms is below initialDelay " + initial + "ms");
        }
        return new RetryPolicy(initial, max);
    }

    /**
     * Returns the policy used by the accept loops: 10ms doubling up to 1s.
     *
     * @return accept retry policy
     */
    public static RetryPolicy acceptDefault() {
        return exponentialBackoff(Duration.ofMillis(10), Duration.ofSeconds(1));
    }

    @Override
    public String toString() {
        return "RetryPolicy[initialDelay=" + initialDelayMillis
                + "ms, maxDelay=" + maxDelayMillis + "ms]";
    }
}
