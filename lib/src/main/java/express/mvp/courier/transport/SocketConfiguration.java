package express.mvp.courier.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-connection socket parameters supplied at bind and connect time.
 *
 * <table border="1">
 *   <caption>Socket configuration parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>connectTimeout</td><td>5s</td><td>TCP connection establishment timeout</td></tr>
 *   <tr><td>sendTimeout</td><td>10s</td><td>Longest a single write may block</td></tr>
 *   <tr><td>receiveTimeout</td><td>10s</td><td>Longest a read may block, if the node type
 *       applies one</td></tr>
 *   <tr><td>sendBufferSize</td><td>64KB</td><td>SO_SNDBUF</td></tr>
 *   <tr><td>receiveBufferSize</td><td>64KB</td><td>SO_RCVBUF</td></tr>
 * </table>
 *
 * <p>A timeout of {@link Duration#ZERO} disables the timeout. The virtual transport ignores every
 * parameter except the node-type policy, which it has no use for either.
 *
 * <pre>{@code
 * SocketConfiguration config = SocketConfiguration.builder()
 *     .sendBufferSize(16384)
 *     .receiveBufferSize(16384)
 *     .receiveTimeout(Duration.ZERO)
 *     .build();
 * }</pre>
 *
 * @see NodeType#hasReceiveTimeout()
 */
public final class SocketConfiguration {

    /** Default buffer size for both directions. */
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    /** Configuration with every parameter at its default. */
    public static final SocketConfiguration DEFAULT = builder().build();

    private final Duration connectTimeout;
    private final Duration sendTimeout;
    private final Duration receiveTimeout;
    private final int sendBufferSize;
    private final int receiveBufferSize;

    private SocketConfiguration(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.sendTimeout = builder.sendTimeout;
        this.receiveTimeout = builder.receiveTimeout;
        this.sendBufferSize = builder.sendBufferSize;
        this.receiveBufferSize = builder.receiveBufferSize;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    /**
     * Returns the receive timeout.
     *
     * <p>Only applied to connections whose {@link NodeType} calls for one.
     *
     * @return the timeout, {@link Duration#ZERO} for none
     */
    public Duration getReceiveTimeout() {
        return receiveTimeout;
    }

    public int getSendBufferSize() {
        return sendBufferSize;
    }

    public int getReceiveBufferSize() {
        return receiveBufferSize;
    }

    /**
     * Converts a timeout into the millisecond form used by sockets, where 0 means infinite.
     *
     * @param timeout the timeout
     * @return milliseconds, at least 1 for any positive duration
     */
    public static long toMillisOrZero(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        return Math.max(1, timeout.toMillis());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SocketConfiguration)) {
            return false;
        }
        SocketConfiguration that = (SocketConfiguration) o;
        return sendBufferSize == that.sendBufferSize
                && receiveBufferSize == that.receiveBufferSize
                && connectTimeout.equals(that.connectTimeout)
                && sendTimeout.equals(that.sendTimeout)
                && receiveTimeout.equals(that.receiveTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                connectTimeout, sendTimeout, receiveTimeout, sendBufferSize, receiveBufferSize);
    }

    @Override
    public String toString() {
        return "SocketConfiguration[connectTimeout=" + connectTimeout
                + ", sendTimeout=" + sendTimeout
                + ", receiveTimeout=" + receiveTimeout
                + ", sendBufferSize=" + sendBufferSize
                + ", receiveBufferSize=" + receiveBufferSize + "]";
    }

    /** Builder for {@link SocketConfiguration}. */
    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration sendTimeout = Duration.ofSeconds(10);
        private Duration receiveTimeout = Duration.ofSeconds(10);
        private int sendBufferSize = DEFAULT_BUFFER_SIZE;
        private int receiveBufferSize = DEFAULT_BUFFER_SIZE;

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requireTimeout(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = requireTimeout(sendTimeout, "sendTimeout");
            return this;
        }

        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = requireTimeout(receiveTimeout, "receiveTimeout");
            return this;
        }

        public Builder sendBufferSize(int sendBufferSize) {
            this.sendBufferSize = requirePositive(sendBufferSize, "sendBufferSize");
            return this;
        }

        public Builder receiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = requirePositive(receiveBufferSize, "receiveBufferSize");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the immutable configuration
         */
        public SocketConfiguration build() {
            return new SocketConfiguration(this);
        }

        private static Duration requireTimeout(Duration timeout, String name) {
            Objects.requireNonNull(timeout, name);
            if (timeout.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative: " + timeout);
            }
            return timeout;
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
