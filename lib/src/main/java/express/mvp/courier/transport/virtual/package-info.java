/**
 * In-process transport: two {@link express.mvp.courier.transport.virtual.VirtualConnection} ends
 * joined by in-memory byte queues, brokered by a
 * {@link express.mvp.courier.transport.virtual.VirtualTransportRegistry}.
 *
 * <p>Virtual endpoints have the form {@code inproc://name}. Nothing touches the network stack, so
 * the virtual transport is also the deterministic choice for tests.
 */
package express.mvp.courier.transport.virtual;
