/**
 * Core transport API: endpoints, connections, the accept and receive loops, and their callbacks.
 *
 * <p>Application code exchanges typed messages over TCP sockets or in-process virtual connections
 * through one {@link express.mvp.courier.transport.Connection} abstraction. Both loop components
 * work on that abstraction only.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.courier.transport.Endpoint} - Transport kind plus host/port or name
 *   <li>{@link express.mvp.courier.transport.SocketAccepter} - Listens and hands out connections
 *   <li>{@link express.mvp.courier.transport.MessageReceiveLoop} - Per-connection frame dispatch
 *   <li>{@link express.mvp.courier.transport.TransportFactory} - Accepters and connectors by kind
 *   <li>{@link express.mvp.courier.transport.SocketConfiguration} - Timeouts and buffer sizes
 * </ul>
 *
 * @see express.mvp.courier.transport.tcp.NetworkAcceptLoop
 * @see express.mvp.courier.transport.virtual.VirtualAcceptLoop
 */
package express.mvp.courier.transport;
