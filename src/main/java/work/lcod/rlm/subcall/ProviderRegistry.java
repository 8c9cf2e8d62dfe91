package work.lcod.rlm.subcall;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider clients available to a run, keyed by lower-case provider name.
 */
public final class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();
    private ProviderSettings settings;

    public ProviderRegistry() {
        this(ProviderSettings.defaults());
    }

    public ProviderRegistry(ProviderSettings settings) {
        this.settings = settings;
    }

    /**
     * Registry populated with every {@link ProviderFactory} visible to the context class loader.
     */
    public static ProviderRegistry discover(ProviderSettings settings) {
        ProviderRegistry registry = new ProviderRegistry(settings);
        for (ProviderFactory factory : ServiceLoader.load(ProviderFactory.class)) {
            String name = normalize(factory.name());
            registry.register(name, factory.create(settings.config(name)));
            log.debug("Discovered provider transport '{}' ({})", name, factory.getClass().getName());
        }
        return registry;
    }

    public ProviderRegistry register(String name, ProviderClient client) {
        clients.put(normalize(name), client);
        return this;
    }

    public Optional<ProviderClient> lookup(String name) {
        return Optional.ofNullable(clients.get(normalize(name)));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(clients.keySet());
    }

    public ProviderSettings settings() {
        return settings;
    }

    public ProviderRegistry withSettings(ProviderSettings settings) {
        this.settings = settings;
        return this;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }
}
