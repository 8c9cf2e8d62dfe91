package work.lcod.rlm.subcall;

/**
 * Transport to a single model provider.
 */
@FunctionalInterface
public interface ProviderClient {
    /**
     * Returns the response text for {@code request}, or throws when this attempt failed and may be retried.
     */
    String complete(ProviderRequest request) throws ProviderException;
}
