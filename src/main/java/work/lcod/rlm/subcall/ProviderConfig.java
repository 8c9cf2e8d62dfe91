package work.lcod.rlm.subcall;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved settings of one provider. Credentials are never stored here; {@code apiKeyEnv} names the
 * environment variable a transport reads them from.
 */
public record ProviderConfig(
    String name,
    String model,
    String baseUrl,
    String apiKeyEnv,
    Duration timeout,
    Map<String, Object> extras
) {
    public ProviderConfig {
        Objects.requireNonNull(name, "name");
        timeout = timeout == null ? ProviderSettings.DEFAULT_TIMEOUT : timeout;
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("api_key_env", apiKeyEnv);
        map.put("base_url", baseUrl);
        map.putAll(extras);
        map.put("model", model);
        map.put("timeout_s", timeout.toMillis() / 1000.0);
        return map;
    }
}
