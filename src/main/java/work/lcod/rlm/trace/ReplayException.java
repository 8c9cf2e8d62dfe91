package work.lcod.rlm.trace;

/**
 * A run directory cannot be summarized: missing executor state or trace.
 */
public final class ReplayException extends RuntimeException {
    public ReplayException(String message) {
        super(message);
    }
}
