package work.lcod.rlm.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.bundle.BuildSummary;
import work.lcod.rlm.bundle.BundleBuilder;
import work.lcod.rlm.executor.ExecutorState;
import work.lcod.rlm.executor.RunReport;
import work.lcod.rlm.executor.RunRequest;
import work.lcod.rlm.executor.RunStatus;
import work.lcod.rlm.executor.TaskExecutor;
import work.lcod.rlm.runtime.StepRuntime;
import work.lcod.rlm.task.Diagnostic;
import work.lcod.rlm.task.TaskDocument;
import work.lcod.rlm.task.TaskLoader;
import work.lcod.rlm.task.TaskValidationException;
import work.lcod.rlm.trace.Replay;

/**
 * Public entry point for embedding the engine. Every call returns a {@link RunResult}; errors never escape.
 */
public final class RlmRunner {
    private static final Logger log = LoggerFactory.getLogger(RlmRunner.class);

    public RunResult validate(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            TaskDocument document = TaskLoader.load(resolve(configuration, requireTask(configuration)));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("status", "VALID");
            metadata.put("task_id", document.task().taskId());
            metadata.put("task_path", document.path().toString());
            metadata.put("task_sha256", document.sha256());
            return RunResult.success(metadata, Instant.now());
        });
    }

    public RunResult bundle(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Instant started = Instant.now();
            TaskDocument document = TaskLoader.load(resolve(configuration, requireTask(configuration)));
            Path outputRoot = configuration.bundleRoot()
                .map(path -> resolve(configuration, path))
                .orElseGet(() -> TaskExecutor.defaultBundleRoot(configuration.workspaceRoot()));
            BuildSummary summary = BundleBuilder.build(document.task(), configuration.workspaceRoot(), outputRoot);
            return RunResult.success(summary.toMap(), started);
        });
    }

    public RunResult run(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Instant started = Instant.now();
            RunRequest request = new RunRequest(
                requireTask(configuration),
                configuration.runDirectory().orElse(null),
                configuration.bundleRoot().orElse(null),
                configuration.cachePath().orElse(null),
                configuration.cacheMode().orElse(null),
                configuration.fresh()
            );
            RunReport report = executor(configuration).run(request);
            return toResult(report, report.status().isSuccessfulEnd(), started);
        });
    }

    public RunResult step(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Instant started = Instant.now();
            RunReport report = executor(configuration).step(requireRunDir(configuration), configuration.cacheMode().orElse(null));
            boolean ok = report.status().isSuccessfulEnd() || report.status() == RunStatus.RUNNING;
            return toResult(report, ok, started);
        });
    }

    public RunResult resume(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Instant started = Instant.now();
            RunReport report = executor(configuration).resume(requireRunDir(configuration), configuration.cacheMode().orElse(null));
            return toResult(report, report.status().isSuccessfulEnd(), started);
        });
    }

    /** Raw runtime state of a run directory, plus the executor state when present. */
    public RunResult showState(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Path runDir = resolve(configuration, requireRunDir(configuration));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("run_dir", runDir.toString());
            metadata.put("runtime_state", StepRuntime.readState(runDir));
            if (ExecutorState.exists(runDir)) {
                metadata.put("executor_state", ExecutorState.load(runDir).toMap());
            }
            return RunResult.success(metadata, Instant.now());
        });
    }

    public RunResult replaySummary(RunConfiguration configuration) {
        return guarded(configuration, () -> {
            Path runDir = resolve(configuration, requireRunDir(configuration));
            return RunResult.success(Replay.summary(runDir).toMap(), Instant.now());
        });
    }

    public RunResult replayCompare(RunConfiguration configuration, Path runA, Path runB) {
        return guarded(configuration, () -> {
            Replay.Comparison comparison = Replay.compare(resolve(configuration, runA), resolve(configuration, runB));
            return comparison.match()
                ? RunResult.success(comparison.toMap(), Instant.now())
                : RunResult.stopped(comparison.toMap(), Instant.now());
        });
    }

    private RunResult guarded(RunConfiguration configuration, Supplier<RunResult> action) {
        var started = Instant.now();
        configuration.logLevel().apply();
        try {
            return action.get();
        } catch (RuntimeException ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("status", "ERROR");
            errorMeta.put("error_type", ex.getClass().getSimpleName());
            if (ex instanceof TaskValidationException invalid) {
                List<Map<String, Object>> diagnostics = new ArrayList<>();
                for (Diagnostic diagnostic : invalid.diagnostics()) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("field", diagnostic.field());
                    entry.put("line", diagnostic.line());
                    entry.put("message", diagnostic.message());
                    diagnostics.add(entry);
                }
                errorMeta.put("diagnostics", diagnostics);
            }
            if (Boolean.getBoolean("rlm.debug")) {
                log.error("Command failed", ex);
            }
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return RunResult.failure(message, errorMeta, started);
        }
    }

    private static RunResult toResult(RunReport report, boolean ok, Instant started) {
        return ok ? RunResult.success(report.toMap(), started) : RunResult.stopped(report.toMap(), started);
    }

    private static TaskExecutor executor(RunConfiguration configuration) {
        return new TaskExecutor(configuration.workspaceRoot(), configuration.providers());
    }

    private static Path requireTask(RunConfiguration configuration) {
        return configuration.taskPath()
            .orElseThrow(() -> new IllegalArgumentException("A task path is required for this command."));
    }

    private static Path requireRunDir(RunConfiguration configuration) {
        return configuration.runDirectory()
            .orElseThrow(() -> new IllegalArgumentException("A run directory is required for this command."));
    }

    private static Path resolve(RunConfiguration configuration, Path path) {
        return path.isAbsolute() ? path.normalize() : configuration.workspaceRoot().resolve(path).normalize();
    }
}
