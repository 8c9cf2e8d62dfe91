package work.lcod.rlm.executor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.bundle.BuildSummary;
import work.lcod.rlm.bundle.Bundle;
import work.lcod.rlm.bundle.BundleBuilder;
import work.lcod.rlm.runtime.StepResult;
import work.lcod.rlm.runtime.StepRuntime;
import work.lcod.rlm.runtime.SubcallHandler;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.RunMdc;
import work.lcod.rlm.subcall.ProviderRegistry;
import work.lcod.rlm.subcall.SubcallCache;
import work.lcod.rlm.subcall.SubcallService;
import work.lcod.rlm.task.Task;
import work.lcod.rlm.task.TaskDocument;
import work.lcod.rlm.task.TaskLoader;
import work.lcod.rlm.task.TaskMode;
import work.lcod.rlm.trace.TraceEvents;
import work.lcod.rlm.trace.TraceLog;

/**
 * Drives a task's step program through the {@link StepRuntime}:
 * {@code RUNNING -> BLOCKED | COMPLETED | LIMIT_REACHED}. Executor state is rewritten after every step and
 * every iteration or terminal transition appends one trace event.
 */
public final class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    public static final Path STATE_ROOT = Path.of(".rlm");

    private final Path workspaceRoot;
    private final ProviderRegistry providers;

    public TaskExecutor(Path workspaceRoot, ProviderRegistry providers) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.providers = providers;
    }

    public static Path defaultBundleRoot(Path workspaceRoot) {
        return workspaceRoot.resolve(STATE_ROOT).resolve("bundles");
    }

    public static Path defaultRunDir(Path workspaceRoot, String taskId) {
        return workspaceRoot.resolve(STATE_ROOT).resolve("runs").resolve(taskId);
    }

    public static Path defaultCachePath(Path workspaceRoot, String taskId) {
        return workspaceRoot.resolve(STATE_ROOT).resolve("cache").resolve(taskId + ".jsonl");
    }

    /**
     * Validates the task, rebuilds its bundle, initializes executor state and steps until a terminal state.
     */
    public RunReport run(RunRequest request) {
        TaskDocument document = TaskLoader.load(resolve(request.taskPath()));
        Task task = document.task();
        task.requireProgram();

        CacheMode cacheMode = request.cacheMode();
        if (cacheMode == null) {
            if (task.mode() == TaskMode.SUBCALLS) {
                throw new IllegalArgumentException("--cache is required for subcalls-mode tasks (off, readonly or readwrite)");
            }
            cacheMode = CacheMode.OFF;
        }

        Path runDir = request.runDir() == null ? defaultRunDir(workspaceRoot, task.taskId()) : resolve(request.runDir());
        Path tracePath = resolve(Path.of(task.trace().tracePath()));
        TraceLog trace = new TraceLog(tracePath, runDir);
        if (ExecutorState.exists(runDir) && !request.fresh()) {
            throw new ResumeException(
                "Run directory " + runDir + " already holds an executor state; use resume or run with --fresh."
            );
        }
        if (request.fresh()) {
            clearPreviousRun(task, runDir, trace);
        }

        Path bundleRoot = request.bundleRoot() == null ? defaultBundleRoot(workspaceRoot) : resolve(request.bundleRoot());
        BuildSummary built = BundleBuilder.build(task, workspaceRoot, bundleRoot);

        Path cachePath = null;
        if (cacheMode != CacheMode.OFF || task.mode() == TaskMode.SUBCALLS) {
            cachePath = request.cachePath() == null ? defaultCachePath(workspaceRoot, task.taskId()) : resolve(request.cachePath());
        }
        ExecutorState state = ExecutorState.init(document, built.bundleDir(), trace.path(), cacheMode, cachePath);
        createDirectories(runDir);
        state.save(runDir);
        log.info("Starting run of task {} in {} (mode={}, cache={})", task.taskId(), runDir, task.mode().wireName(), cacheMode.wireName());

        Session session = open(task, state, runDir, trace);
        return session.drive(true);
    }

    /** Performs exactly one iteration of an existing run. */
    public RunReport step(Path runDir, CacheMode cacheOverride) {
        Path dir = resolve(runDir);
        Session session = reenter(dir, cacheOverride);
        return session.drive(false);
    }

    /** Continues an existing run from its persisted cursor until a terminal state. */
    public RunReport resume(Path runDir, CacheMode cacheOverride) {
        Path dir = resolve(runDir);
        Session session = reenter(dir, cacheOverride);
        return session.drive(true);
    }

    private Session reenter(Path runDir, CacheMode cacheOverride) {
        ExecutorState state = ExecutorState.load(runDir);
        Path taskPath = state.taskPath();
        if (!Files.isRegularFile(taskPath)) {
            throw new ResumeException("Task path in executor state no longer exists: " + taskPath);
        }
        if (!Hashing.sha256(taskPath).equals(state.taskSha256())) {
            throw new ResumeException("Task content changed since executor state was created; resume would be ambiguous.");
        }
        if (cacheOverride != null && cacheOverride != state.cacheMode()) {
            throw new ResumeException(
                "Requested cache mode '" + cacheOverride.wireName() + "' does not match recorded mode '"
                    + state.cacheMode().wireName() + "'."
            );
        }
        Task task = TaskLoader.load(taskPath).task();
        task.requireProgram();
        if (!Files.isDirectory(state.bundleDir())) {
            log.info("Bundle {} is missing; rebuilding", state.bundleDir());
            BundleBuilder.build(task, workspaceRoot, state.bundleDir().getParent());
        }
        if (state.status() == RunStatus.BLOCKED || state.status() == RunStatus.LIMIT_REACHED) {
            log.info("Reopening run {} (was {} / {})", runDir, state.status(), state.stopReason());
            state.reopen();
        }
        return open(task, state, runDir, new TraceLog(state.tracePath(), runDir));
    }

    private Session open(Task task, ExecutorState state, Path runDir, TraceLog trace) {
        Bundle bundle = Bundle.load(state.bundleDir());
        StepRuntime runtime = new StepRuntime(bundle, runDir, state.maxStdoutChars());
        SubcallHandler subcalls = null;
        if (task.mode() == TaskMode.SUBCALLS) {
            SubcallCache cache = state.cachePath() == null ? null : SubcallCache.open(state.cachePath());
            subcalls = new SubcallService(
                task.providerPolicy(),
                task.limits(),
                state.cacheMode(),
                cache,
                providers,
                state.subcalls(),
                trace,
                task.trace().recordsText()
            );
        }
        return new Session(task, state, runDir, trace, runtime, subcalls);
    }

    private void clearPreviousRun(Task task, Path runDir, TraceLog trace) {
        deleteRecursively(runDir);
        trace.discardRun();
        ArtifactWriter.deleteIfPresent(resolve(Path.of(task.outputs().finalPath())));
        for (String artifact : task.outputs().artifactPaths()) {
            ArtifactWriter.deleteIfPresent(resolve(Path.of(artifact)));
        }
        log.info("Cleared previous run state in {}", runDir);
    }

    private Path resolve(Path path) {
        Path expanded = path;
        if (path.toString().startsWith("~")) {
            expanded = Path.of(System.getProperty("user.home") + path.toString().substring(1));
        }
        return (expanded.isAbsolute() ? expanded : workspaceRoot.resolve(expanded)).normalize();
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create " + dir, ex);
        }
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to remove " + dir, ex);
        }
    }

    /** One invocation over one run directory. */
    private final class Session {
        private final Task task;
        private final ExecutorState state;
        private final Path runDir;
        private final TraceLog trace;
        private final StepRuntime runtime;
        private final SubcallHandler subcalls;

        Session(Task task, ExecutorState state, Path runDir, TraceLog trace, StepRuntime runtime, SubcallHandler subcalls) {
            this.task = task;
            this.state = state;
            this.runDir = runDir;
            this.trace = trace;
            this.runtime = runtime;
            this.subcalls = subcalls;
        }

        RunReport drive(boolean untilTerminal) {
            RunMdc.setRun(task.taskId(), runDir);
            try {
                if (state.status() == RunStatus.COMPLETED) {
                    return report();
                }
                boolean more = stepOnce();
                state.save(runDir);
                while (untilTerminal && more) {
                    more = stepOnce();
                    state.save(runDir);
                }
                return report();
            } finally {
                RunMdc.clear();
            }
        }

        /**
         * Returns true while the run remains {@code RUNNING}.
         */
        private boolean stepOnce() {
            if (state.status() != RunStatus.RUNNING) {
                return false;
            }
            if (runtime.finalized()) {
                // finalized by a step whose completion was never recorded
                complete(runtime.finalPayload());
                return false;
            }
            if (runtime.iteration() >= state.maxRootIters()) {
                stop(RunStatus.LIMIT_REACHED, StopReason.MAX_ROOT_ITERS);
                return false;
            }
            List<String> program = task.requireProgram();
            int cursor = state.cursor();
            if (cursor >= program.size()) {
                stop(RunStatus.LIMIT_REACHED, StopReason.PROGRAM_EXHAUSTED);
                return false;
            }

            RunMdc.setIteration(runtime.iteration() + 1);
            state.subcalls().startIteration(runtime.iteration() + 1);
            StepResult result = runtime.step(program.get(cursor), subcalls);
            trace.append(TraceEvents.iteration(result, cursor));
            state.advanceCursor();
            log.debug("Iteration {} ran program[{}]", result.iteration(), cursor);

            if (!result.ok()) {
                stop(RunStatus.BLOCKED, StopReason.STEP_ERROR);
                return false;
            }
            if (result.finalized()) {
                complete(result.finalPayload());
                return false;
            }
            if (runtime.iteration() >= state.maxRootIters()) {
                stop(RunStatus.LIMIT_REACHED, StopReason.MAX_ROOT_ITERS);
                return false;
            }
            return true;
        }

        private void complete(Object payload) {
            Path finalPath = resolve(Path.of(task.outputs().finalPath()));
            String sha = ArtifactWriter.writeFinal(finalPath, payload);
            state.recordFinalArtifact(finalPath, sha);
            state.transition(RunStatus.COMPLETED, StopReason.FINAL);
            List<Path> reports = new ArrayList<>();
            for (String artifact : task.outputs().artifactPaths()) {
                reports.add(resolve(Path.of(artifact)));
            }
            ArtifactWriter.writeReports(reports, runReport());
            recordStop();
        }

        private void stop(RunStatus status, StopReason reason) {
            state.transition(status, reason);
            recordStop();
        }

        private void recordStop() {
            trace.append(TraceEvents.stop(
                state.status().name(),
                state.stopReason().name(),
                runtime.finalized(),
                runtime.iteration()
            ));
            log.info("Run {} stopped: {} ({}) after {} iteration(s)", task.taskId(), state.status(), state.stopReason(), runtime.iteration());
        }

        private Map<String, Object> runReport() {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("final_artifact", state.finalArtifact());
            report.put("final_artifact_sha256", state.finalArtifactSha256());
            report.put("iteration", runtime.iteration());
            report.put("response_hashes", state.subcalls().responseHashes());
            report.put("status", state.status().name());
            report.put("stop_reason", state.stopReason() == null ? null : state.stopReason().name());
            report.put("task_id", task.taskId());
            return report;
        }

        private RunReport report() {
            return new RunReport(
                runDir,
                task.taskId(),
                state.status(),
                state.stopReason(),
                state.cursor(),
                runtime.iteration(),
                state.finalArtifact(),
                state.tracePath().toString(),
                state.cacheMode().wireName(),
                state.subcalls().total()
            );
        }
    }
}
