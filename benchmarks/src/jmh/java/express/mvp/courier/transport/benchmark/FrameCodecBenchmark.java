package express.mvp.courier.transport.benchmark;

import express.mvp.courier.transport.framing.Frame;
import express.mvp.courier.transport.framing.FrameCodec;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Cost of encoding a frame and decoding its header, across payload sizes.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FrameCodecBenchmark {

    @Param({"16", "1024", "65536"})
    private int payloadSize;

    private final FrameCodec codec = FrameCodec.defaultCodec();
    private Frame frame;
    private byte[] encoded;

    @Setup(Level.Trial)
    public void setup() {
        byte[] payload = new byte[payloadSize];
        ThreadLocalRandom.current().nextBytes(payload);
        frame = new Frame(42, payload);
        encoded = codec.encode(frame);
    }

    @Benchmark
    public byte[] encode() {
        return codec.encode(frame);
    }

    @Benchmark
    public FrameCodec.Header decodeHeader() {
        return codec.decodeHeader(encoded, 0);
    }
}
