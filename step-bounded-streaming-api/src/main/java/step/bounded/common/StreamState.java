package step.bounded.common;

/**
 * Lifecycle state of a bounded stream.
 */
public enum StreamState {
    /**
     * Initial state: data is flowing (or awaited).
     */
    OPEN,
    /**
     * End of input was reached within bounds.
     */
    FLUSHED,
    /**
     * A fault occurred (size violation, stall, unexpected error). Terminal.
     */
    ERRORED,
    /**
     * The stream was torn down explicitly. Terminal.
     */
    DESTROYED;

    public boolean isTerminal() {
        return this == ERRORED || this == DESTROYED;
    }
}
