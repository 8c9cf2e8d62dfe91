package work.lcod.rlm.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;
import work.lcod.rlm.support.RlmTestSupport;

class TaskLoaderTest {
    @Test
    void loadsJsonTaskWithHash() throws Exception {
        var workspace = RlmTestSupport.workspace();
        var path = RlmTestSupport.writeTask(workspace, RlmTestSupport.task("demo", "baseline", List.of("finalize(1)")));

        TaskDocument document = TaskLoader.load(path);

        assertEquals("demo", document.task().taskId());
        assertEquals(TaskMode.BASELINE, document.task().mode());
        assertEquals(Hashing.sha256(Files.readAllBytes(path)), document.sha256());
        assertEquals(List.of("finalize(1)"), document.task().requireProgram());
        assertEquals(ProviderPolicy.DEFAULT_MAX_ATTEMPTS, document.task().providerPolicy().maxAttempts());
    }

    @Test
    void loadsYamlTask() throws Exception {
        var workspace = RlmTestSupport.workspace();
        var path = workspace.resolve("task.yaml");
        Files.writeString(path, String.join("\n",
            "task_id: yaml-demo",
            "query: What is in the docs?",
            "context_sources:",
            "  - type: dir",
            "    path: docs",
            "bundle:",
            "  chunking_strategy: by_chars",
            "  max_chars: 100",
            "mode: subcalls",
            "provider_policy:",
            "  primary: OpenAI",
            "  allowed: [openai]",
            "  fallback: []",
            "  max_attempts: 3",
            "limits:",
            "  max_root_iters: 2",
            "  max_depth: 0",
            "  max_subcalls_total: 1",
            "  max_subcalls_per_iter: 1",
            "  timeout_s: 5",
            "  max_stdout_chars: 100",
            "outputs:",
            "  final_path: out/final.txt",
            "trace:",
            "  trace_path: out/trace.jsonl",
            "  redaction_mode: none",
            ""
        ));

        Task task = TaskLoader.load(path).task();

        assertEquals(TaskMode.SUBCALLS, task.mode());
        assertEquals("openai", task.providerPolicy().primary());
        assertEquals(3, task.providerPolicy().maxAttempts());
        assertTrue(task.trace().recordsText());
        assertTrue(task.program().isEmpty());
    }

    @Test
    void reportsParseErrorLine() {
        var ex = assertThrows(TaskValidationException.class, () -> TaskLoader.parse("{\n\"task_id\": \"x\",\n,\n}", false, "broken.json"));
        assertEquals(1, ex.diagnostics().size());
        assertEquals(3, ex.diagnostics().get(0).line());
        assertTrue(ex.getMessage().startsWith("INVALID: broken.json"));
    }

    @Test
    void rejectsInvalidDocumentAsAWhole() {
        var task = RlmTestSupport.task("demo", "baseline", List.of());
        task.remove("query");
        RlmTestSupport.section(task, "bundle").put("max_chars", -3);
        String raw = JsonFiles.toPrettyJson(task);

        var ex = assertThrows(TaskValidationException.class, () -> TaskLoader.parse(raw, false, "t.json"));

        assertEquals(2, ex.diagnostics().size());
    }

    @Test
    void requireProgramRejectsEmptyProgram() {
        var task = RlmTestSupport.task("demo", "baseline", List.of());
        Task parsed = TaskLoader.parse(JsonFiles.toPrettyJson(task), false, "t.json");
        assertThrows(IllegalStateException.class, parsed::requireProgram);
    }

    @Test
    void missingFileIsReported() throws Exception {
        var workspace = RlmTestSupport.workspace();
        assertThrows(IllegalStateException.class, () -> TaskLoader.load(workspace.resolve("nope.json")));
    }
}
