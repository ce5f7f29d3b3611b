/**
 * Wire framing: a 2-byte type id and a 4-byte length, both little-endian, followed by the payload.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.courier.transport.framing.FrameCodec} - Header layout and limits
 *   <li>{@link express.mvp.courier.transport.framing.FrameReceiver} - Resumable whole-frame reads
 *   <li>{@link express.mvp.courier.transport.framing.FrameSender} - Single-write frame output
 * </ul>
 */
package express.mvp.courier.transport.framing;
