package work.lcod.rlm.subcall;

/**
 * A subcall was refused or could not be answered. Raised inside step code, it surfaces as a step error.
 */
public final class SubcallException extends RuntimeException {
    public enum Reason {
        BUDGET,
        PROVIDER_NOT_ALLOWED,
        PROVIDERS_EXHAUSTED,
        CACHE_MISS,
        UNAVAILABLE
    }

    private final Reason reason;

    public SubcallException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SubcallException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
