package work.lcod.rlm.subcall;

/**
 * Service-provider entry point for provider transports, discovered through {@link java.util.ServiceLoader}
 * ({@code META-INF/services/work.lcod.rlm.subcall.ProviderFactory}).
 */
public interface ProviderFactory {
    /** Lower-case provider name, as used in task provider policies. */
    String name();

    ProviderClient create(ProviderConfig config);
}
