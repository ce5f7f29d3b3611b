package express.mvp.courier.server;

import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.framing.FrameCodec;
import express.mvp.courier.transport.serialization.SerializationRegistry;
import express.mvp.courier.transport.virtual.VirtualTransportRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for a {@link CourierServer} instance.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Options and defaults</caption>
 *   <tr><th>Option</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>endpoint</td><td>(required)</td><td>One or more endpoints to listen on</td></tr>
 *   <tr><td>nodeType</td><td>RESPONDER</td><td>Socket policy for accepted connections</td></tr>
 *   <tr><td>socketConfiguration</td><td>{@link SocketConfiguration#DEFAULT}</td>
 *       <td>Timeouts and buffer sizes</td></tr>
 *   <tr><td>serializationRegistry</td><td>process-wide instance</td>
 *       <td>Message (de)serializers</td></tr>
 *   <tr><td>virtualRegistry</td><td>process-wide instance</td>
 *       <td>Directory for {@code inproc://} endpoints</td></tr>
 *   <tr><td>maxPayloadSize</td><td>16 MB</td><td>Largest accepted frame payload</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CourierServerConfig config = CourierServerConfig.builder()
 *     .endpoint(Endpoint.network("0.0.0.0", 7400))
 *     .endpoint(Endpoint.virtual("orders"))
 *     .nodeType(NodeType.RESPONDER)
 *     .serializationRegistry(registry)
 *     .build();
 * }</pre>
 *
 * @see CourierServer
 */
public final class CourierServerConfig {

    private final List<Endpoint> endpoints;
    private final NodeType nodeType;
    private final SocketConfiguration socketConfiguration;
    private final SerializationRegistry serializationRegistry;
    private final VirtualTransportRegistry virtualRegistry;
    private final int maxPayloadSize;

    private CourierServerConfig(Builder builder) {
        this.endpoints = Collections.unmodifiableList(new ArrayList<>(builder.endpoints));
        this.nodeType = builder.nodeType;
        this.socketConfiguration = builder.socketConfiguration;
        this.serializationRegistry = builder.serializationRegistry;
        this.virtualRegistry = builder.virtualRegistry;
        this.maxPayloadSize = builder.maxPayloadSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public SocketConfiguration getSocketConfiguration() {
        return socketConfiguration;
    }

    public SerializationRegistry getSerializationRegistry() {
        return serializationRegistry;
    }

    public VirtualTransportRegistry getVirtualRegistry() {
        return virtualRegistry;
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    @Override
    public String toString() {
        return "CourierServerConfig[endpoints=" + endpoints
                + ", nodeType=" + nodeType
                + ", socketConfiguration=" + socketConfiguration
                + ", maxPayloadSize=" + maxPayloadSize + "]";
    }

    /** Builder for {@link CourierServerConfig}. */
    public static final class Builder {
        private final List<Endpoint> endpoints = new ArrayList<>();
        private NodeType nodeType = NodeType.RESPONDER;
        private SocketConfiguration socketConfiguration = SocketConfiguration.DEFAULT;
        private SerializationRegistry serializationRegistry = SerializationRegistry.defaultInstance();
        private VirtualTransportRegistry virtualRegistry = VirtualTransportRegistry.defaultInstance();
        private int maxPayloadSize = FrameCodec.DEFAULT_MAX_PAYLOAD_SIZE;

        private Builder() {}

        /**
         * Adds an endpoint to listen on.
         *
         * @param endpoint network or virtual endpoint
         * @return this builder
         */
        public Builder endpoint(Endpoint endpoint) {
            this.endpoints.add(Objects.requireNonNull(endpoint, "endpoint"));
            return this;
        }

        public Builder nodeType(NodeType nodeType) {
            this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
            return this;
        }

        public Builder socketConfiguration(SocketConfiguration socketConfiguration) {
            this.socketConfiguration =
                    Objects.requireNonNull(socketConfiguration, "socketConfiguration");
            return this;
        }

        public Builder serializationRegistry(SerializationRegistry serializationRegistry) {
            this.serializationRegistry =
                    Objects.requireNonNull(serializationRegistry, "serializationRegistry");
            return this;
        }

        public Builder virtualRegistry(VirtualTransportRegistry virtualRegistry) {
            this.virtualRegistry = Objects.requireNonNull(virtualRegistry, "virtualRegistry");
            return this;
        }

        public Builder maxPayloadSize(int maxPayloadSize) {
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if no endpoint was added or the payload limit is not
         *     positive
         */
        public CourierServerConfig build() {
            if (endpoints.isEmpty()) {
                throw new IllegalArgumentException("At least one endpoint is required");
            }
            if (maxPayloadSize <= 0) {
                throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
            }
            return new CourierServerConfig(this);
        }
    }
}
