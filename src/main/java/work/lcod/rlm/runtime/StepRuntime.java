package work.lcod.rlm.runtime;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.bundle.Bundle;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Iterative, resumable interpreter over a context bundle. Each {@link #step} runs one snippet of step code,
 * captures (and caps) what it prints, appends one event and persists {@code state.json} before returning.
 */
public final class StepRuntime {
    private static final Logger log = LoggerFactory.getLogger(StepRuntime.class);

    public static final String STATE_FILE = "state.json";
    public static final String TRUNCATION_MARKER = "\n...[truncated]\n";

    private final Bundle bundle;
    private final Path runDir;
    private final Path statePath;
    private final Map<String, Object> contextInfo;
    private final RuntimeState state;

    /**
     * Opens (or initializes) the runtime state in {@code runDir}. Existing state is resumed only when it was
     * produced against the same bundle contents, stdout cap and runtime version.
     */
    public StepRuntime(Bundle bundle, Path runDir, int maxStdoutChars) {
        if (maxStdoutChars < 1) {
            throw new IllegalArgumentException("max_stdout_chars must be >= 1");
        }
        this.bundle = bundle;
        this.runDir = runDir.toAbsolutePath().normalize();
        this.statePath = this.runDir.resolve(STATE_FILE);
        this.contextInfo = contextInfo(bundle);
        try {
            Files.createDirectories(this.runDir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create run directory " + this.runDir, ex);
        }

        if (Files.isRegularFile(statePath)) {
            Map<String, Object> payload;
            try {
                payload = JsonFiles.readObject(statePath);
            } catch (UncheckedIOException | IllegalStateException ex) {
                throw new RuntimeStateException("State file is not a readable JSON object: " + statePath);
            }
            this.state = RuntimeState.restore(
                payload,
                bundle.directory().toString(),
                bundle.fingerprint(),
                maxStdoutChars
            );
            log.info("Resumed runtime state at iteration {} from {}", state.iteration(), statePath);
        } else {
            this.state = RuntimeState.fresh(bundle.directory().toString(), bundle.fingerprint(), maxStdoutChars);
            save();
        }
    }

    public StepResult step(String code) {
        return step(code, null);
    }

    /**
     * Executes one step. Step code failures are reported in the result; only stepping a finalized runtime
     * throws.
     */
    public StepResult step(String code, SubcallHandler subcalls) {
        if (state.finalized()) {
            throw new RuntimeStateException("Runtime already finalized; additional steps are not allowed.");
        }
        String source = code == null ? "" : code;
        StepSandbox sandbox = new StepSandbox(bundle, contextInfo, state.memory(), subcalls, state::finalizeWith);
        StepSandbox.Outcome outcome = sandbox.execute(source);

        String rawStdout = outcome.stdout();
        Truncated stdout = truncate(rawStdout, state.maxStdoutChars());
        int iteration = state.nextIteration();
        int stdoutChars = rawStdout.codePointCount(0, rawStdout.length());
        String codeSha = Hashing.sha256(source);
        String stdoutSha = Hashing.sha256(rawStdout);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("code_sha256", codeSha);
        event.put("error", outcome.error() == null ? null : outcome.error().render());
        event.put("finalized", state.finalized());
        event.put("iteration", iteration);
        event.put("stdout_chars", stdoutChars);
        event.put("stdout_sha256", stdoutSha);
        event.put("stdout_truncated", stdout.truncated());
        state.events().add(event);
        save();

        if (outcome.error() != null) {
            log.debug("Step {} failed: {}", iteration, outcome.error().kind());
        } else {
            log.debug("Step {} ok (stdout {} chars, finalized={})", iteration, stdoutChars, state.finalized());
        }
        return new StepResult(
            outcome.error(),
            stdout.text(),
            stdout.truncated(),
            state.finalized(),
            state.finalPayload(),
            iteration,
            codeSha,
            stdoutChars,
            stdoutSha
        );
    }

    public int iteration() {
        return state.iteration();
    }

    public boolean finalized() {
        return state.finalized();
    }

    public Object finalPayload() {
        return state.finalPayload();
    }

    public Map<String, Object> memorySnapshot() {
        return state.memory().snapshot();
    }

    public List<Map<String, Object>> events() {
        return new ArrayList<>(state.events());
    }

    public Path runDir() {
        return runDir;
    }

    public Path statePath() {
        return statePath;
    }

    /** Raw persisted state, for display. */
    public static Map<String, Object> readState(Path runDir) {
        Path path = runDir.resolve(STATE_FILE);
        if (!Files.isRegularFile(path)) {
            throw new RuntimeStateException("Missing state file: " + path);
        }
        try {
            return JsonFiles.readObject(path);
        } catch (UncheckedIOException | IllegalStateException ex) {
            throw new RuntimeStateException("State file is not an object: " + path);
        }
    }

    /**
     * Caps {@code text} at {@code maxChars} code points. The marker is part of the cap, so when the cap is
     * shorter than the marker only a prefix of the marker is returned.
     */
    static Truncated truncate(String text, int maxChars) {
        int length = text.codePointCount(0, text.length());
        if (length <= maxChars) {
            return new Truncated(text, false);
        }
        int markerLength = TRUNCATION_MARKER.length();
        int keep = maxChars - markerLength;
        if (keep <= 0) {
            return new Truncated(TRUNCATION_MARKER.substring(0, maxChars), true);
        }
        return new Truncated(text.substring(0, text.offsetByCodePoints(0, keep)) + TRUNCATION_MARKER, true);
    }

    record Truncated(String text, boolean truncated) {}

    private void save() {
        JsonFiles.writeAtomically(statePath, state.toMap());
    }

    private static Map<String, Object> contextInfo(Bundle bundle) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("bundle_dir", bundle.directory().toString());
        info.put("bundle_fingerprint", bundle.fingerprint());
        info.put("chunk_count", bundle.chunks().size());
        info.put("sources", bundle.sources());
        info.put("task_id", bundle.taskId());
        return info;
    }
}
