package express.mvp.courier.transport.lifecycle;

/**
 * Represents the states of a background loop (accept loop or receive loop).
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌────────┐  start()  ┌──────────┐  loop thread up  ┌─────────┐
 * │  IDLE  │──────────▶│ STARTING │─────────────────▶│ RUNNING │
 * └────────┘           └──────────┘                  └─────────┘
 *     ▲                      │ thread failed              │ │
 *     │◀─────────────────────┘                            │ │ stop()
 *     │                                                   │ ▼
 *     │        loop exited on its own (end of stream)     │ ┌──────────┐
 *     │◀──────────────────────────────────────────────────┘ │ STOPPING │
 *     │                                                     └──────────┘
 *     │                       loop exited                        │
 *     └──────────────────────────────────────────────────────────┘
 * </pre>
 *
 * @see LoopStateMachine
 */
public enum LoopState {

    /** No loop thread exists. The loop can be started. */
    IDLE("Idle", false),

    /** A loop thread is being launched; the starter is waiting for {@link #RUNNING}. */
    STARTING("Starting", true),

    /** The loop thread is consuming input. */
    RUNNING("Running", true),

    /** Cancellation was signalled; the loop thread has not exited yet. */
    STOPPING("Stopping", true);

    private final String displayName;
    private final boolean active;

    LoopState(String displayName, boolean active) {
        this.displayName = displayName;
        this.active = active;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether a loop thread may exist in this state.
     *
     * @return true for every state except {@link #IDLE}
     */
    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
