package work.lcod.rlm.task;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of raw task documents. Produces every violation it finds; callers treat any
 * non-empty result as a rejection of the whole document.
 */
public final class TaskValidator {
    static final List<String> TOP_LEVEL_REQUIRED = List.of(
        "task_id",
        "query",
        "context_sources",
        "bundle",
        "mode",
        "provider_policy",
        "limits",
        "outputs",
        "trace"
    );

    private static final Map<String, Integer> LIMIT_FLOORS = limitFloors();

    private final LineIndex lines;
    private final List<Diagnostic> errors = new ArrayList<>();

    private TaskValidator(LineIndex lines) {
        this.lines = lines;
    }

    public static List<Diagnostic> validate(Object document, LineIndex lines) {
        var validator = new TaskValidator(lines == null ? LineIndex.empty() : lines);
        validator.validateRoot(document);
        return List.copyOf(validator.errors);
    }

    private void validateRoot(Object document) {
        if (!(document instanceof Map<?, ?> task)) {
            error("<root>", "Task document must be a JSON object.");
            return;
        }
        for (String key : TOP_LEVEL_REQUIRED) {
            if (!task.containsKey(key)) {
                error(key, "Missing required top-level field '" + key + "'.");
            }
        }

        Object taskId = task.get("task_id");
        if (taskId != null && !isNonEmptyString(taskId)) {
            error("task_id", "Field 'task_id' must be a non-empty string.");
        }
        Object query = task.get("query");
        if (query != null && !isNonEmptyString(query)) {
            error("query", "Field 'query' must be a non-empty string.");
        }
        Object mode = task.get("mode");
        if (mode != null) {
            if (!isNonEmptyString(mode)) {
                error("mode", "Field 'mode' must be a non-empty string.");
            } else if (!TaskMode.isKnown((String) mode)) {
                error("mode", "Field 'mode' must be one of: baseline, subcalls.");
            }
        }

        validateContextSources(task.get("context_sources"));
        validateBundle(task.get("bundle"));
        validateProviderPolicy(task.get("provider_policy"));
        validateLimits(task.get("limits"));
        validateOutputs(task.get("outputs"));
        validateTrace(task.get("trace"));
    }

    private void validateContextSources(Object value) {
        if (!(value instanceof List<?> sources)) {
            error("context_sources", "Field 'context_sources' must be an array.");
            return;
        }
        if (sources.isEmpty()) {
            error("context_sources", "Field 'context_sources' must not be empty.");
            return;
        }
        for (int i = 0; i < sources.size(); i++) {
            String prefix = "context_sources[" + i + "]";
            if (!(sources.get(i) instanceof Map<?, ?> source)) {
                error(prefix, prefix + " must be an object.");
                continue;
            }
            if (!isNonEmptyString(source.get("type"))) {
                error(prefix + ".type", prefix + ".type must be a non-empty string.");
            }
            if (!isNonEmptyString(source.get("path"))) {
                error(prefix + ".path", prefix + ".path must be a non-empty string.");
            }
            if (source.get("include") != null) {
                ensureStringList(source.get("include"), prefix + ".include", true);
            }
            if (source.get("exclude") != null) {
                ensureStringList(source.get("exclude"), prefix + ".exclude", true);
            }
        }
    }

    private void validateBundle(Object value) {
        if (!(value instanceof Map<?, ?> bundle)) {
            error("bundle", "Field 'bundle' must be an object.");
            return;
        }
        if (!isNonEmptyString(bundle.get("chunking_strategy"))) {
            error("bundle.chunking_strategy", "Field 'bundle.chunking_strategy' must be a non-empty string.");
        }
        Object maxChars = bundle.get("max_chars");
        if (!isInteger(maxChars) || ((Number) maxChars).longValue() <= 0) {
            error("bundle.max_chars", "Field 'bundle.max_chars' must be an integer >= 1.");
        }
    }

    private void validateProviderPolicy(Object value) {
        if (!(value instanceof Map<?, ?> policy)) {
            error("provider_policy", "Field 'provider_policy' must be an object.");
            return;
        }
        Object primary = policy.get("primary");
        if (!isNonEmptyString(primary)) {
            error("provider_policy.primary", "Field 'provider_policy.primary' must be a non-empty string.");
        }
        Object allowed = policy.get("allowed");
        ensureStringList(allowed, "provider_policy.allowed", false);
        Object fallback = policy.get("fallback");
        ensureStringList(fallback, "provider_policy.fallback", true);

        Set<String> normalizedAllowed = new LinkedHashSet<>();
        if (allowed instanceof List<?> allowedList) {
            for (Object item : allowedList) {
                if (isNonEmptyString(item)) {
                    normalizedAllowed.add(ProviderPolicy.normalize((String) item));
                }
            }
            if (isNonEmptyString(primary) && !normalizedAllowed.contains(ProviderPolicy.normalize((String) primary))) {
                error(
                    "provider_policy.primary",
                    "Field 'provider_policy.primary' must be present in provider_policy.allowed."
                );
            }
        }
        if (allowed instanceof List<?> && fallback instanceof List<?> fallbackList) {
            for (int i = 0; i < fallbackList.size(); i++) {
                Object item = fallbackList.get(i);
                if (isNonEmptyString(item) && !normalizedAllowed.contains(ProviderPolicy.normalize((String) item))) {
                    error(
                        "provider_policy.fallback[" + i + "]",
                        "provider_policy.fallback entries must also be present in provider_policy.allowed."
                    );
                }
            }
        }
        Object maxAttempts = policy.get("max_attempts");
        if (maxAttempts != null && (!isInteger(maxAttempts) || ((Number) maxAttempts).longValue() < 1)) {
            error("provider_policy.max_attempts", "Field 'provider_policy.max_attempts' must be an integer >= 1.");
        }
    }

    private void validateLimits(Object value) {
        if (!(value instanceof Map<?, ?> limits)) {
            error("limits", "Field 'limits' must be an object.");
            return;
        }
        for (var entry : LIMIT_FLOORS.entrySet()) {
            Object raw = limits.get(entry.getKey());
            if (!isInteger(raw) || ((Number) raw).longValue() < entry.getValue()) {
                error(
                    "limits." + entry.getKey(),
                    "Field 'limits." + entry.getKey() + "' must be an integer >= " + entry.getValue() + "."
                );
            } else if (((Number) raw).longValue() > Integer.MAX_VALUE) {
                error("limits." + entry.getKey(), "Field 'limits." + entry.getKey() + "' is out of range.");
            }
        }
    }

    private void validateOutputs(Object value) {
        if (!(value instanceof Map<?, ?> outputs)) {
            error("outputs", "Field 'outputs' must be an object.");
            return;
        }
        if (!isNonEmptyString(outputs.get("final_path"))) {
            error("outputs.final_path", "Field 'outputs.final_path' must be a non-empty string.");
        }
        if (outputs.get("artifact_paths") != null) {
            ensureStringList(outputs.get("artifact_paths"), "outputs.artifact_paths", true);
        }
    }

    private void validateTrace(Object value) {
        if (!(value instanceof Map<?, ?> trace)) {
            error("trace", "Field 'trace' must be an object.");
            return;
        }
        if (!isNonEmptyString(trace.get("trace_path"))) {
            error("trace.trace_path", "Field 'trace.trace_path' must be a non-empty string.");
        }
        if (!isNonEmptyString(trace.get("redaction_mode"))) {
            error("trace.redaction_mode", "Field 'trace.redaction_mode' must be a non-empty string.");
        }
    }

    private void ensureStringList(Object value, String field, boolean allowEmpty) {
        if (!(value instanceof List<?> list)) {
            error(field, "Field '" + field + "' must be an array.");
            return;
        }
        if (!allowEmpty && list.isEmpty()) {
            error(field, "Field '" + field + "' must not be empty.");
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            if (!isNonEmptyString(list.get(i))) {
                error(field + "[" + i + "]", field + "[" + i + "] must be a non-empty string.");
            }
        }
    }

    private void error(String field, String message) {
        errors.add(new Diagnostic(field, lines.lineFor(field), message));
    }

    static boolean isNonEmptyString(Object value) {
        return value instanceof String str && !str.isBlank();
    }

    static boolean isInteger(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
            || (value instanceof BigInteger big && big.bitLength() < 63);
    }

    private static Map<String, Integer> limitFloors() {
        var floors = new LinkedHashMap<String, Integer>();
        floors.put("max_root_iters", 1);
        floors.put("max_depth", 0);
        floors.put("max_subcalls_total", 0);
        floors.put("max_subcalls_per_iter", 0);
        floors.put("timeout_s", 1);
        floors.put("max_stdout_chars", 1);
        return floors;
    }
}
