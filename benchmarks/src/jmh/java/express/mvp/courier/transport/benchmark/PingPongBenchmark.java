package express.mvp.courier.transport.benchmark;

import express.mvp.courier.server.CourierServer;
import express.mvp.courier.server.CourierServerConfig;
import express.mvp.courier.server.CourierServerHandler;
import express.mvp.courier.transport.Connection;
import express.mvp.courier.transport.Endpoint;
import express.mvp.courier.transport.NodeType;
import express.mvp.courier.transport.SocketConfiguration;
import express.mvp.courier.transport.TransportFactory;
import express.mvp.courier.transport.framing.Frame;
import express.mvp.courier.transport.framing.FrameReceiver;
import express.mvp.courier.transport.serialization.Message;
import express.mvp.courier.transport.serialization.MessageSender;
import express.mvp.courier.transport.serialization.SerializationRegistry;
import express.mvp.courier.transport.virtual.VirtualTransportRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Round-trip latency of one small message through a {@link CourierServer} echo handler.
 *
 * <p>Runs over both transports: {@code VIRTUAL} shows the cost of framing, serialization and the
 * receive loop hand-offs alone, {@code NETWORK} adds loopback TCP.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 2, time = 5)
@Measurement(iterations = 3, time = 10)
public class PingPongBenchmark {

    @Param({"VIRTUAL", "NETWORK"})
    private String transport;

    private CourierServer server;
    private Connection client;
    private FrameReceiver replies;
    private MessageSender sender;
    private SerializationRegistry registry;
    private long sequence;

    @Setup
    public void setup() {
        registry = new SerializationRegistry();
        registry.register(Ping.TYPE_ID, Ping.class, Ping::encode, Ping::decode);
        VirtualTransportRegistry virtualRegistry = new VirtualTransportRegistry();

        Endpoint endpoint = "NETWORK".equals(transport)
                ? Endpoint.network("127.0.0.1", 0)
                : Endpoint.virtual("ping-pong-" + System.nanoTime());

        CourierServerConfig config = CourierServerConfig.builder()
                .endpoint(endpoint)
                .serializationRegistry(registry)
                .virtualRegistry(virtualRegistry)
                .build();

        sender = new MessageSender(registry);
        server = new CourierServer(config, new CourierServerHandler() {
            @Override
            public void onMessageReceived(Connection connection, Message message) {
                try {
                    server.send(connection, message);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        });
        server.start();

        Endpoint bound = server.getBoundEndpoints().get(0);
        client = TransportFactory
                .createConnector(bound.getTransportKind(), NodeType.REQUESTER, virtualRegistry)
                .connect(bound, SocketConfiguration.DEFAULT);
        replies = new FrameReceiver(client);
    }

    @TearDown
    public void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Benchmark
    public long pingPong() throws IOException {
        sender.send(client, new Ping(++sequence));
        Frame reply = replies.receive();
        return ((Ping) registry.deserialize(reply.typeId(), reply.payload())).sequence();
    }

    /** Eight-byte benchmark message. */
    public record Ping(long sequence) implements Message {

        static final int TYPE_ID = 1;

        @Override
        public int getMessageTypeId() {
            return TYPE_ID;
        }

        static byte[] encode(Ping ping) {
            return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN)
                    .putLong(ping.sequence).array();
        }

        static Ping decode(byte[] payload) {
            return new Ping(ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN).getLong());
        }
    }
}
