package work.lcod.rlm.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.rlm.support.RlmTestSupport;

class TaskValidatorTest {
    @Test
    void acceptsCompleteTask() {
        var task = RlmTestSupport.task("demo", "baseline", List.of("finalize('x')"));
        assertTrue(TaskValidator.validate(task, null).isEmpty());
    }

    @Test
    void rejectsNonObjectRoot() {
        var diagnostics = TaskValidator.validate(List.of(1, 2), null);
        assertEquals(1, diagnostics.size());
        assertEquals("<root>", diagnostics.get(0).field());
    }

    @Test
    void reportsEveryMissingTopLevelField() {
        var diagnostics = TaskValidator.validate(Map.of(), null);
        var fields = fields(diagnostics);
        for (String key : TaskValidator.TOP_LEVEL_REQUIRED) {
            assertTrue(fields.contains(key), "missing diagnostic for " + key);
        }
    }

    @Test
    void rejectsUnknownMode() {
        var task = RlmTestSupport.task("demo", "turbo", List.of());
        assertEquals(List.of("mode"), fields(TaskValidator.validate(task, null)));
    }

    @Test
    void primaryMustBeAllowed() {
        var task = RlmTestSupport.task("demo", "subcalls", List.of());
        RlmTestSupport.section(task, "provider_policy").put("primary", "google");
        assertEquals(List.of("provider_policy.primary"), fields(TaskValidator.validate(task, null)));
    }

    @Test
    void providerNamesCompareCaseInsensitively() {
        var task = RlmTestSupport.task("demo", "subcalls", List.of());
        RlmTestSupport.section(task, "provider_policy").put("primary", "OpenAI");
        RlmTestSupport.section(task, "provider_policy").put("fallback", List.of(" Anthropic "));
        assertTrue(TaskValidator.validate(task, null).isEmpty());
    }

    @Test
    void fallbackEntriesMustBeAllowed() {
        var task = RlmTestSupport.task("demo", "subcalls", List.of());
        RlmTestSupport.section(task, "provider_policy").put("fallback", List.of("anthropic", "triton"));
        assertEquals(List.of("provider_policy.fallback[1]"), fields(TaskValidator.validate(task, null)));
    }

    @Test
    void allowedMustNotBeEmpty() {
        var task = RlmTestSupport.task("demo", "subcalls", List.of());
        var policy = RlmTestSupport.section(task, "provider_policy");
        policy.put("allowed", List.of());
        policy.put("fallback", List.of());
        var fields = fields(TaskValidator.validate(task, null));
        assertTrue(fields.contains("provider_policy.allowed"));
    }

    @Test
    void enforcesLimitFloors() {
        var task = RlmTestSupport.task("demo", "baseline", List.of());
        var limits = RlmTestSupport.section(task, "limits");
        limits.put("max_root_iters", 0);
        limits.put("max_subcalls_total", -1);
        limits.put("timeout_s", "30");
        limits.put("max_stdout_chars", 1.5);
        assertEquals(
            List.of("limits.max_root_iters", "limits.max_subcalls_total", "limits.timeout_s", "limits.max_stdout_chars"),
            fields(TaskValidator.validate(task, null))
        );
    }

    @Test
    void zeroSubcallBudgetsAreValid() {
        var task = RlmTestSupport.task("demo", "subcalls", List.of());
        var limits = RlmTestSupport.section(task, "limits");
        limits.put("max_subcalls_total", 0);
        limits.put("max_subcalls_per_iter", 0);
        limits.put("max_depth", 0);
        assertTrue(TaskValidator.validate(task, null).isEmpty());
    }

    @Test
    void bundleMaxCharsMustBePositive() {
        var task = RlmTestSupport.task("demo", "baseline", List.of());
        RlmTestSupport.section(task, "bundle").put("max_chars", 0);
        assertEquals(List.of("bundle.max_chars"), fields(TaskValidator.validate(task, null)));
    }

    @Test
    void contextSourcesMustNotBeEmpty() {
        var task = RlmTestSupport.task("demo", "baseline", List.of());
        task.put("context_sources", List.of());
        assertEquals(List.of("context_sources"), fields(TaskValidator.validate(task, null)));
    }

    @Test
    void pointsDiagnosticsAtTheOffendingLine() {
        String raw = "{\n  \"task_id\": \"demo\",\n  \"mode\": \"turbo\"\n}";
        var diagnostics = TaskValidator.validate(Map.of("task_id", "demo", "mode", "turbo"), LineIndex.of(raw, false));
        var mode = diagnostics.stream().filter(d -> d.field().equals("mode")).findFirst().orElseThrow();
        assertEquals(3, mode.line());
    }

    private static List<String> fields(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::field).collect(Collectors.toList());
    }
}
