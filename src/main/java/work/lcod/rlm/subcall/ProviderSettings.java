package work.lcod.rlm.subcall;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.rlm.shared.DurationParser;

/**
 * Provider settings resolved from built-in defaults, then {@code ~/.rlm/providers.toml}, then
 * {@code <workspace>/.rlm/providers.toml}. Later files override individual keys of earlier ones.
 *
 * <pre>
 * [providers.openai]
 * model = "gpt-4.1-mini"
 * timeout = "30s"
 * </pre>
 */
public final class ProviderSettings {
    private static final Logger log = LoggerFactory.getLogger(ProviderSettings.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);
    public static final String CONFIG_FILE = "providers.toml";
    private static final Set<String> SECRET_KEYS = Set.of("api_key", "token", "secret");

    private final Map<String, Map<String, Object>> providers;

    private ProviderSettings(Map<String, Map<String, Object>> providers) {
        this.providers = providers;
    }

    public static ProviderSettings defaults() {
        return new ProviderSettings(builtIns());
    }

    public static ProviderSettings load(Path workspaceRoot) {
        return load(workspaceRoot, Path.of(System.getProperty("user.home")));
    }

    public static ProviderSettings load(Path workspaceRoot, Path homeDir) {
        Map<String, Map<String, Object>> resolved = builtIns();
        if (homeDir != null) {
            merge(resolved, homeDir.resolve(".rlm").resolve(CONFIG_FILE));
        }
        if (workspaceRoot != null) {
            merge(resolved, workspaceRoot.resolve(".rlm").resolve(CONFIG_FILE));
        }
        return new ProviderSettings(resolved);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(providers.keySet());
    }

    public Optional<ProviderConfig> find(String name) {
        Map<String, Object> raw = providers.get(normalize(name));
        if (raw == null) {
            return Optional.empty();
        }
        Map<String, Object> extras = new LinkedHashMap<>(raw);
        String model = stringOrNull(extras.remove("model"));
        String baseUrl = stringOrNull(extras.remove("base_url"));
        String apiKeyEnv = stringOrNull(extras.remove("api_key_env"));
        Object timeoutRaw = extras.containsKey("timeout") ? extras.remove("timeout") : extras.get("timeout_s");
        extras.remove("timeout_s");
        Duration timeout = DurationParser.parseOrDefault(timeoutRaw, DEFAULT_TIMEOUT);
        return Optional.of(new ProviderConfig(normalize(name), model, baseUrl, apiKeyEnv, timeout, extras));
    }

    /** Settings for {@code name}; unknown providers get an otherwise empty configuration. */
    public ProviderConfig config(String name) {
        return find(name).orElseGet(() -> new ProviderConfig(normalize(name), null, null, null, DEFAULT_TIMEOUT, Map.of()));
    }

    public Map<String, Object> describe() {
        Map<String, Object> view = new TreeMap<>();
        for (String name : providers.keySet()) {
            view.put(name, config(name).toMap());
        }
        return view;
    }

    private static void merge(Map<String, Map<String, Object>> target, Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read provider settings " + file, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid provider settings " + file + ": " + errors);
        }
        TomlTable section = result.getTable("providers");
        if (section == null) {
            return;
        }
        for (String name : section.keySet()) {
            TomlTable provider = section.getTable(name);
            if (provider == null) {
                throw new IllegalArgumentException("Provider config for '" + name + "' must be a table in " + file);
            }
            Map<String, Object> entry = target.computeIfAbsent(normalize(name), key -> new LinkedHashMap<>());
            for (String key : provider.keySet()) {
                if (SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                    throw new IllegalArgumentException(
                        "Provider '" + name + "' in " + file + " contains inline secret field '" + key
                            + "'. Use environment variables only."
                    );
                }
                entry.put(key, plain(provider.get(key)));
            }
        }
        log.debug("Merged provider settings from {}", file);
    }

    private static Object plain(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

    private static Map<String, Map<String, Object>> builtIns() {
        Map<String, Map<String, Object>> defaults = new LinkedHashMap<>();
        defaults.put("openai", provider("gpt-4.1-mini", "https://api.openai.com/v1", "OPENAI_API_KEY"));
        defaults.put("anthropic", provider("claude-3-5-haiku-latest", "https://api.anthropic.com/v1", "ANTHROPIC_API_KEY"));
        defaults.put("google", provider("gemini-1.5-flash", "https://generativelanguage.googleapis.com/v1beta", "GOOGLE_API_KEY"));
        Map<String, Object> triton = provider("tensorrt_llm", "http://localhost:8000", null);
        triton.put("codec", "raw_text");
        triton.put("input_name", "text_input");
        defaults.put("triton", triton);
        return defaults;
    }

    private static Map<String, Object> provider(String model, String baseUrl, String apiKeyEnv) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("model", model);
        entry.put("base_url", baseUrl);
        if (apiKeyEnv != null) {
            entry.put("api_key_env", apiKeyEnv);
        }
        entry.put("timeout_s", 20L);
        return entry;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }
}
