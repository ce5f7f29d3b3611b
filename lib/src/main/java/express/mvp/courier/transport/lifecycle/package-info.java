/**
 * Lifecycle state tracking for background loops.
 *
 * <p>Both loop kinds in this library (the accept loops and the per-connection receive loop) follow
 * the same four-state lifecycle, recorded by a {@link
 * express.mvp.courier.transport.lifecycle.LoopStateMachine}:
 *
 * <pre>
 * IDLE → STARTING → RUNNING → STOPPING → IDLE
 * </pre>
 *
 * @see express.mvp.courier.transport.MessageReceiveLoop
 * @see express.mvp.courier.transport.AbstractAcceptLoop
 */
package express.mvp.courier.transport.lifecycle;
