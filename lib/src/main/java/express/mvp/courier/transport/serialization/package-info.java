/**
 * Conversion between typed messages and frame payloads.
 *
 * <p>A {@link express.mvp.courier.transport.serialization.SerializationRegistry} holds one
 * serializer/deserializer pair per type id. Failures are per frame: an unknown type id raises
 * {@link express.mvp.courier.transport.serialization.UnknownMessageTypeException}, a failing or
 * null-returning converter raises
 * {@link express.mvp.courier.transport.serialization.MalformedPayloadException}.
 */
package express.mvp.courier.transport.serialization;
