package work.lcod.rlm.executor;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.shared.JsonFiles;
import work.lcod.rlm.subcall.SubcallCounters;
import work.lcod.rlm.task.Limits;
import work.lcod.rlm.task.TaskDocument;
import work.lcod.rlm.task.TaskMode;

/**
 * Persisted executor bookkeeping ({@code executor_state.json}): cursor, status, budgets, cache settings,
 * subcall totals and the task identity a resume is checked against.
 */
public final class ExecutorState {
    public static final String FILE_NAME = "executor_state.json";
    static final int STATE_VERSION = 1;

    private String taskId;
    private String taskPath;
    private String taskSha256;
    private TaskMode mode;
    private String bundleDir;
    private String tracePath;
    private CacheMode cacheMode;
    private String cachePath;
    private int maxRootIters;
    private int maxStdoutChars;
    private int maxSubcallsTotal;
    private int maxSubcallsPerIter;
    private int cursor;
    private RunStatus status = RunStatus.RUNNING;
    private StopReason stopReason;
    private String finalArtifact;
    private String finalArtifactSha256;
    private SubcallCounters subcalls = new SubcallCounters();

    private ExecutorState() {}

    static ExecutorState init(
        TaskDocument document,
        Path bundleDir,
        Path tracePath,
        CacheMode cacheMode,
        Path cachePath
    ) {
        ExecutorState state = new ExecutorState();
        Limits limits = document.task().limits();
        state.taskId = document.task().taskId();
        state.taskPath = document.path().toString();
        state.taskSha256 = document.sha256();
        state.mode = document.task().mode();
        state.bundleDir = bundleDir.toString();
        state.tracePath = tracePath.toString();
        state.cacheMode = cacheMode;
        state.cachePath = cachePath == null ? null : cachePath.toString();
        state.maxRootIters = limits.maxRootIters();
        state.maxStdoutChars = limits.maxStdoutChars();
        state.maxSubcallsTotal = limits.maxSubcallsTotal();
        state.maxSubcallsPerIter = limits.maxSubcallsPerIter();
        return state;
    }

    public static boolean exists(Path runDir) {
        return Files.isRegularFile(runDir.resolve(FILE_NAME));
    }

    public static ExecutorState load(Path runDir) {
        Path path = runDir.resolve(FILE_NAME);
        if (!Files.isRegularFile(path)) {
            throw new ResumeException("Missing executor state: " + path);
        }
        Map<String, Object> raw;
        try {
            raw = JsonFiles.readObject(path);
        } catch (UncheckedIOException | IllegalStateException ex) {
            throw new ResumeException("Executor state is not a readable JSON object: " + path, ex);
        }
        try {
            return fromMap(raw);
        } catch (RuntimeException ex) {
            throw new ResumeException("Executor state " + path + " is malformed: " + ex.getMessage(), ex);
        }
    }

    void save(Path runDir) {
        JsonFiles.writeAtomically(runDir.resolve(FILE_NAME), toMap());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("bundle_dir", bundleDir);
        map.put("cache_mode", cacheMode.wireName());
        map.put("cache_path", cachePath);
        map.put("cursor", cursor);
        map.put("final_artifact", finalArtifact);
        map.put("final_artifact_sha256", finalArtifactSha256);
        map.put("max_root_iters", maxRootIters);
        map.put("max_stdout_chars", maxStdoutChars);
        map.put("max_subcalls_per_iter", maxSubcallsPerIter);
        map.put("max_subcalls_total", maxSubcallsTotal);
        map.put("mode", mode.wireName());
        map.put("state_version", STATE_VERSION);
        map.put("status", status.name());
        map.put("stop_reason", stopReason == null ? null : stopReason.name());
        map.put("subcalls", subcalls.toMap());
        map.put("task_id", taskId);
        map.put("task_path", taskPath);
        map.put("task_sha256", taskSha256);
        map.put("trace_path", tracePath);
        return map;
    }

    static ExecutorState fromMap(Map<String, Object> raw) {
        ExecutorState state = new ExecutorState();
        state.taskId = requiredString(raw, "task_id");
        state.taskPath = requiredString(raw, "task_path");
        state.taskSha256 = requiredString(raw, "task_sha256").strip();
        state.mode = TaskMode.from(requiredString(raw, "mode"));
        state.bundleDir = requiredString(raw, "bundle_dir");
        state.tracePath = requiredString(raw, "trace_path");
        state.cacheMode = CacheMode.from(requiredString(raw, "cache_mode"));
        state.cachePath = raw.get("cache_path") == null ? null : String.valueOf(raw.get("cache_path"));
        state.maxRootIters = requiredInt(raw, "max_root_iters");
        state.maxStdoutChars = requiredInt(raw, "max_stdout_chars");
        state.maxSubcallsTotal = requiredInt(raw, "max_subcalls_total");
        state.maxSubcallsPerIter = requiredInt(raw, "max_subcalls_per_iter");
        state.cursor = requiredInt(raw, "cursor");
        state.status = RunStatus.valueOf(requiredString(raw, "status"));
        Object reason = raw.get("stop_reason");
        state.stopReason = reason == null ? null : StopReason.valueOf(String.valueOf(reason));
        state.finalArtifact = raw.get("final_artifact") == null ? null : String.valueOf(raw.get("final_artifact"));
        Object finalSha = raw.get("final_artifact_sha256");
        state.finalArtifactSha256 = finalSha == null ? null : String.valueOf(finalSha);
        state.subcalls = SubcallCounters.fromMap(raw.get("subcalls"));
        return state;
    }

    private static String requiredString(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (!(value instanceof String str) || str.isBlank()) {
            throw new IllegalArgumentException("field '" + key + "' must be a non-empty string");
        }
        return str;
    }

    private static int requiredInt(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("field '" + key + "' must be an integer");
        }
        return number.intValue();
    }

    void transition(RunStatus status, StopReason reason) {
        this.status = status;
        this.stopReason = reason;
    }

    void reopen() {
        this.status = RunStatus.RUNNING;
        this.stopReason = null;
    }

    void advanceCursor() {
        cursor++;
    }

    void recordFinalArtifact(Path path, String sha256) {
        this.finalArtifact = path.toString();
        this.finalArtifactSha256 = sha256;
    }

    public String taskId() {
        return taskId;
    }

    public Path taskPath() {
        return Path.of(taskPath);
    }

    public String taskSha256() {
        return taskSha256;
    }

    public TaskMode mode() {
        return mode;
    }

    public Path bundleDir() {
        return Path.of(bundleDir);
    }

    public Path tracePath() {
        return Path.of(tracePath);
    }

    public CacheMode cacheMode() {
        return cacheMode;
    }

    public Path cachePath() {
        return cachePath == null ? null : Path.of(cachePath);
    }

    public int maxRootIters() {
        return maxRootIters;
    }

    public int maxStdoutChars() {
        return maxStdoutChars;
    }

    public int cursor() {
        return cursor;
    }

    public RunStatus status() {
        return status;
    }

    public StopReason stopReason() {
        return stopReason;
    }

    public String finalArtifact() {
        return finalArtifact;
    }

    public String finalArtifactSha256() {
        return finalArtifactSha256;
    }

    public SubcallCounters subcalls() {
        return subcalls;
    }
}
