package work.lcod.rlm.task;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.rlm.shared.Hashing;

/**
 * Reads task documents (JSON, or YAML for {@code .yaml}/{@code .yml} files), validates them and maps them to
 * {@link Task}. Nothing is returned unless the whole document is valid.
 */
public final class TaskLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TaskLoader() {}

    public static TaskDocument load(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(absolute);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read task file '" + absolute + "': " + ex.getMessage(), ex);
        }
        Task task = parse(new String(bytes, StandardCharsets.UTF_8), isYaml(absolute), absolute.toString());
        return new TaskDocument(absolute, task, Hashing.sha256(bytes));
    }

    /**
     * Parses and validates raw task text. {@code source} only labels diagnostics.
     */
    public static Task parse(String raw, boolean yaml, String source) {
        Object document;
        try {
            document = (yaml ? YAML_MAPPER : JSON_MAPPER).readValue(raw, Object.class);
        } catch (JsonProcessingException ex) {
            JsonLocation location = ex.getLocation();
            int line = location == null ? 1 : Math.max(1, location.getLineNr());
            String format = yaml ? "YAML" : "JSON";
            throw new TaskValidationException(
                source,
                List.of(new Diagnostic("<root>", line, "invalid " + format + " (" + ex.getOriginalMessage() + ").")
            ));
        }
        List<Diagnostic> diagnostics = TaskValidator.validate(document, LineIndex.of(raw, yaml));
        if (!diagnostics.isEmpty()) {
            throw new TaskValidationException(source, diagnostics);
        }
        return toTask((Map<?, ?>) document);
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static Task toTask(Map<?, ?> doc) {
        List<ContextSource> sources = new ArrayList<>();
        for (Object raw : (List<?>) doc.get("context_sources")) {
            Map<?, ?> source = (Map<?, ?>) raw;
            sources.add(new ContextSource(
                ((String) source.get("type")).strip(),
                (String) source.get("path"),
                strings(source.get("include")),
                strings(source.get("exclude"))
            ));
        }

        Map<?, ?> bundle = (Map<?, ?>) doc.get("bundle");
        Map<?, ?> policy = (Map<?, ?>) doc.get("provider_policy");
        Map<?, ?> limits = (Map<?, ?>) doc.get("limits");
        Map<?, ?> outputs = (Map<?, ?>) doc.get("outputs");
        Map<?, ?> trace = (Map<?, ?>) doc.get("trace");

        Object maxAttempts = policy.get("max_attempts");
        return new Task(
            (String) doc.get("task_id"),
            (String) doc.get("query"),
            sources,
            new BundleSpec(((String) bundle.get("chunking_strategy")).strip(), intValue(bundle.get("max_chars"))),
            TaskMode.from((String) doc.get("mode")),
            new ProviderPolicy(
                (String) policy.get("primary"),
                strings(policy.get("allowed")),
                strings(policy.get("fallback")),
                maxAttempts == null ? ProviderPolicy.DEFAULT_MAX_ATTEMPTS : intValue(maxAttempts)
            ),
            new Limits(
                intValue(limits.get("max_root_iters")),
                intValue(limits.get("max_depth")),
                intValue(limits.get("max_subcalls_total")),
                intValue(limits.get("max_subcalls_per_iter")),
                intValue(limits.get("timeout_s")),
                intValue(limits.get("max_stdout_chars"))
            ),
            new Outputs((String) outputs.get("final_path"), strings(outputs.get("artifact_paths"))),
            new TraceConfig((String) trace.get("trace_path"), (String) trace.get("redaction_mode")),
            programOf(doc.get("program"))
        );
    }

    private static List<String> programOf(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<String> program = new ArrayList<>(list.size());
        for (Object item : list) {
            program.add(item instanceof String str ? str : "");
        }
        return program;
    }

    private static List<String> strings(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<String> values = new ArrayList<>(list.size());
        for (Object item : list) {
            values.add(String.valueOf(item));
        }
        return values;
    }

    private static int intValue(Object raw) {
        return ((Number) raw).intValue();
    }
}
