package work.lcod.rlm.bundle;

/**
 * Raised when a context bundle cannot be built or loaded.
 */
public final class BundleException extends RuntimeException {
    public BundleException(String message) {
        super(message);
    }

    public BundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
