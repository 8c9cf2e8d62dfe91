package work.lcod.rlm.task;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Provider selection settings of a task. Names are normalized to lower case on construction.
 */
public record ProviderPolicy(String primary, List<String> allowed, List<String> fallback, int maxAttempts) {
    public static final int DEFAULT_MAX_ATTEMPTS = 2;

    public ProviderPolicy {
        Objects.requireNonNull(primary, "primary");
        primary = normalize(primary);
        allowed = allowed == null ? List.of() : allowed.stream().map(ProviderPolicy::normalize).toList();
        fallback = fallback == null ? List.of() : fallback.stream().map(ProviderPolicy::normalize).toList();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public boolean isAllowed(String provider) {
        return provider != null && allowed.contains(normalize(provider));
    }

    /**
     * Deterministic candidate order for one query. A named provider yields only itself, or nothing when it is
     * not allowed; otherwise the order is primary, then fallback, then the remaining allowed providers.
     */
    public List<String> candidates(String requested) {
        if (requested != null && !requested.isBlank()) {
            return isAllowed(requested) ? List.of(normalize(requested)) : List.of();
        }
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        ordered.add(primary);
        ordered.addAll(fallback);
        ordered.addAll(allowed);
        return List.copyOf(ordered);
    }

    public static String normalize(String provider) {
        return provider.strip().toLowerCase(Locale.ROOT);
    }
}
