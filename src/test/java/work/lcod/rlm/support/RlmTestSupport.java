package work.lcod.rlm.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.rlm.bundle.Bundle;
import work.lcod.rlm.bundle.BundleBuilder;
import work.lcod.rlm.shared.JsonFiles;
import work.lcod.rlm.task.TaskLoader;

/**
 * Shared fixtures: a temporary workspace with a small {@code docs/} tree and task documents built as mutable
 * maps so individual tests can tweak single fields.
 */
public final class RlmTestSupport {
    private RlmTestSupport() {}

    public static Path workspace() throws IOException {
        Path root = Files.createTempDirectory("rlm-test");
        Path docs = Files.createDirectories(root.resolve("docs"));
        Files.writeString(docs.resolve("alpha.md"), "# Alpha\nfirst line\nTODO: write more\n");
        Files.writeString(docs.resolve("beta.md"), "# Beta\nsecond file\n");
        Files.writeString(docs.resolve("notes.txt"), "not markdown\n");
        return root;
    }

    public static Map<String, Object> task(String taskId, String mode, List<String> program) {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("task_id", taskId);
        task.put("query", "Summarize the docs");

        Map<String, Object> source = new LinkedHashMap<>();
        source.put("type", "dir");
        source.put("path", "docs");
        source.put("include", List.of("*.md"));
        source.put("exclude", List.of());
        task.put("context_sources", new ArrayList<>(List.of(source)));

        Map<String, Object> bundle = new LinkedHashMap<>();
        bundle.put("chunking_strategy", "by_chars");
        bundle.put("max_chars", 400);
        task.put("bundle", bundle);
        task.put("mode", mode);

        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("primary", "openai");
        policy.put("allowed", List.of("openai", "anthropic"));
        policy.put("fallback", List.of("anthropic"));
        task.put("provider_policy", policy);

        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("max_root_iters", 8);
        limits.put("max_depth", 0);
        limits.put("max_subcalls_total", 4);
        limits.put("max_subcalls_per_iter", 2);
        limits.put("timeout_s", 30);
        limits.put("max_stdout_chars", 4000);
        task.put("limits", limits);

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("final_path", "out/" + taskId + "/final.txt");
        outputs.put("artifact_paths", List.of());
        task.put("outputs", outputs);

        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("trace_path", "out/" + taskId + "/trace.jsonl");
        trace.put("redaction_mode", "hashes");
        task.put("trace", trace);

        task.put("program", new ArrayList<>(program));
        return task;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> section(Map<String, Object> task, String key) {
        return (Map<String, Object>) task.get(key);
    }

    public static Path writeTask(Path workspace, Map<String, Object> task) {
        Path path = workspace.resolve("tasks").resolve(task.get("task_id") + ".json");
        JsonFiles.writePretty(path, task);
        return path;
    }

    /** Builds the bundle of a default baseline task over {@code docs/*.md} and loads it. */
    public static Bundle bundle(Path workspace) {
        var task = TaskLoader.parse(JsonFiles.toPrettyJson(task("demo", "baseline", List.of())), false, "demo.json");
        return Bundle.load(BundleBuilder.build(task, workspace, workspace.resolve("bundles")).bundleDir());
    }
}
