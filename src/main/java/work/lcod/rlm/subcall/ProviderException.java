package work.lcod.rlm.subcall;

/**
 * Transport-level failure of a single provider attempt. Consumed by the retry and fallback loop.
 */
public class ProviderException extends Exception {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
