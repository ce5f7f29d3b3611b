package express.mvp.courier.transport.tcp;

import express.mvp.courier.transport.Endpoint;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Turns network endpoints into socket addresses.
 *
 * <p>The hosts {@code *}, {@code 0.0.0.0} and the empty string name the wildcard address: bind on
 * every interface, or connect to the local host.
 */
final class HostResolver {

    private HostResolver() {
        // Utility class
    }

    static boolean isWildcard(String host) {
        return host.isEmpty() || "*".equals(host) || "0.0.0.0".equals(host);
    }

    /**
     * Resolves the address to listen on.
     *
     * @throws UnknownHostException if the host cannot be resolved
     */
    static InetSocketAddress resolveLocal(Endpoint endpoint) throws UnknownHostException {
        if (isWildcard(endpoint.getHost())) {
            return new InetSocketAddress(endpoint.getPort());
        }
        return new InetSocketAddress(InetAddress.getByName(endpoint.getHost()), endpoint.getPort());
    }

    /**
     * Resolves the address to connect to.
     *
     * @throws UnknownHostException if the host cannot be resolved
     */
    static InetSocketAddress resolveRemote(Endpoint endpoint) throws UnknownHostException {
        if (isWildcard(endpoint.getHost())) {
            return new InetSocketAddress(InetAddress.getLoopbackAddress(), endpoint.getPort());
        }
        return new InetSocketAddress(InetAddress.getByName(endpoint.getHost()), endpoint.getPort());
    }
}
