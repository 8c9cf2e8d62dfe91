package work.lcod.rlm.executor;

/**
 * Executor states. {@code RUNNING} is initial; the others end the current invocation.
 */
public enum RunStatus {
    RUNNING,
    BLOCKED,
    COMPLETED,
    LIMIT_REACHED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /** Statuses a {@code run} or {@code resume} invocation reports as success. */
    public boolean isSuccessfulEnd() {
        return this == COMPLETED || this == LIMIT_REACHED;
    }
}
