package work.lcod.rlm.executor;

/**
 * A run cannot be (re)entered without changing its semantics: missing or unreadable executor state, task
 * content drift, a cache mode override that differs from the recorded one, or a run directory already in use.
 */
public final class ResumeException extends RuntimeException {
    public ResumeException(String message) {
        super(message);
    }

    public ResumeException(String message, Throwable cause) {
        super(message, cause);
    }
}
