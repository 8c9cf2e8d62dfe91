package work.lcod.rlm.task;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated task definition.
 */
public record Task(
    String taskId,
    String query,
    List<ContextSource> contextSources,
    BundleSpec bundle,
    TaskMode mode,
    ProviderPolicy providerPolicy,
    Limits limits,
    Outputs outputs,
    TraceConfig trace,
    List<String> program
) {
    public Task {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(providerPolicy, "providerPolicy");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(outputs, "outputs");
        Objects.requireNonNull(trace, "trace");
        contextSources = List.copyOf(contextSources);
        program = program == null ? List.of() : List.copyOf(program);
    }

    /**
     * Returns the step program, failing when the task does not carry a runnable one.
     */
    public List<String> requireProgram() {
        if (program.isEmpty()) {
            throw new IllegalStateException("Task must define a non-empty 'program' list to be executed.");
        }
        for (int i = 0; i < program.size(); i++) {
            if (program.get(i).isBlank()) {
                throw new IllegalStateException("program[" + i + "] must be a non-empty string.");
            }
        }
        return program;
    }
}
