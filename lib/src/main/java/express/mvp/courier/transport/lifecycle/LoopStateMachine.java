package express.mvp.courier.transport.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the lifecycle of a background loop.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes. The
 * owning loop keeps its start and stop barriers (latches) itself; the state machine only records
 * where the loop is and rejects impossible moves.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * IDLE     → STARTING
 * STARTING → RUNNING, IDLE
 * RUNNING  → STOPPING, IDLE
 * STOPPING → IDLE
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Transitions use compare-and-set so two racing callers cannot
 * both move the loop out of the same state.
 *
 * @see LoopState
 * @see LoopStateListener
 */
public final class LoopStateMachine {

    private static final Logger LOGGER = Logger.getLogger(LoopStateMachine.class.getName());

    private static final Set<LoopState> FROM_IDLE = EnumSet.of(LoopState.STARTING);

    private static final Set<LoopState> FROM_STARTING =
            EnumSet.of(LoopState.RUNNING, LoopState.IDLE);

    private static final Set<LoopState> FROM_RUNNING =
            EnumSet.of(LoopState.STOPPING, LoopState.IDLE);

    private static final Set<LoopState> FROM_STOPPING = EnumSet.of(LoopState.IDLE);

    private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.IDLE);

    private final List<LoopStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Name of the owning loop, for logging. */
    private final String loopName;

    /**
     * Creates a new state machine in {@link LoopState#IDLE}.
     *
     * @param loopName name of the owning loop, used in log messages
     */
    public LoopStateMachine(String loopName) {
        this.loopName = loopName;
    }

    /**
     * Returns the current state.
     *
     * @return the current loop state
     */
    public LoopState getState() {
        return state.get();
    }

    public String getLoopName() {
        return loopName;
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(LoopStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(LoopStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state from whatever the current state is.
     *
     * @param newState the desired new state
     * @return true if the transition was valid and performed
     */
    public boolean transitionTo(LoopState newState) {
        while (true) {
            LoopState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState);
                return true;
            }
        }
    }

    /**
     * Attempts to transition from a specific expected state.
     *
     * @param expectedState the expected current state
     * @param newState the desired new state
     * @return true if the transition succeeded, false if the current state did not match
     */
    public boolean transitionFrom(LoopState expectedState, LoopState newState) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            notifyListeners(expectedState, newState);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(LoopState from, LoopState to) {
        if (from == to) {
            return false;
        }
        return switch (from) {
            case IDLE -> FROM_IDLE.contains(to);
            case STARTING -> FROM_STARTING.contains(to);
            case RUNNING -> FROM_RUNNING.contains(to);
            case STOPPING -> FROM_STOPPING.contains(to);
        };
    }

    private void notifyListeners(LoopState previous, LoopState current) {
        LOGGER.log(Level.FINE, "{0}: {1} -> {2}", new Object[] {loopName, previous, current});
        for (LoopStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Loop state listener failed for " + loopName, e);
            }
        }
    }

    @Override
    public String toString() {
        return "LoopStateMachine[" + loopName + ":" + state.get() + "]";
    }
}
