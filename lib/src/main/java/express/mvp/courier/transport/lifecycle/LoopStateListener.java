package express.mvp.courier.transport.lifecycle;

/**
 * Callback interface for loop state change events.
 *
 * <p>Callbacks run synchronously on the thread performing the transition, which for
 * {@link LoopState#RUNNING} and the final {@link LoopState#IDLE} is the loop thread itself.
 * Implementations should be quick and non-blocking.
 *
 * @see LoopStateMachine
 */
@FunctionalInterface
public interface LoopStateListener {

    /**
     * Called when the loop state changes.
     *
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     */
    void onStateChanged(LoopState previousState, LoopState currentState);
}
