/**
 * TCP transport: {@link express.mvp.courier.transport.tcp.NetworkConnection},
 * {@link express.mvp.courier.transport.tcp.NetworkAcceptLoop} and
 * {@link express.mvp.courier.transport.tcp.NetworkConnector}.
 *
 * <p>Network endpoints have the form {@code tcp://host:port}. The hosts {@code *} and
 * {@code 0.0.0.0} bind on every interface.
 */
package express.mvp.courier.transport.tcp;
