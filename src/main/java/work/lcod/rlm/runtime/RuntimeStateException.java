package work.lcod.rlm.runtime;

/**
 * Runtime state is missing, malformed, ambiguous for resume, or already finalized.
 */
public final class RuntimeStateException extends RuntimeException {
    public RuntimeStateException(String message) {
        super(message);
    }
}
