/**
 * Ready-made server on top of the Courier transport.
 *
 * <p>{@link express.mvp.courier.server.CourierServer} binds one accepter per configured endpoint,
 * runs a receive loop per connection and reports every event to a
 * {@link express.mvp.courier.server.CourierServerHandler}.
 */
package express.mvp.courier.server;
