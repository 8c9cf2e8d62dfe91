package work.lcod.rlm.trace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Append-only JSONL trace of one run. Every line is a sorted-key object stamped with {@code recorded_at} and
 * the owning {@code run_dir}, so several runs may share a trace file without their events being confused.
 */
public final class TraceLog {
    public static final String RECORDED_AT = "recorded_at";
    public static final String RUN_DIR = "run_dir";

    private final Path path;
    private final String runDir;
    private final Clock clock;

    public TraceLog(Path path, Path runDir) {
        this(path, runDir, Clock.systemUTC());
    }

    TraceLog(Path path, Path runDir, Clock clock) {
        this.path = path.toAbsolutePath().normalize();
        this.runDir = runDir.toAbsolutePath().normalize().toString();
        this.clock = clock;
    }

    public void append(Map<String, Object> event) {
        Map<String, Object> line = new LinkedHashMap<>(event);
        line.put(RECORDED_AT, Instant.now(clock).toString());
        line.put(RUN_DIR, runDir);
        JsonFiles.appendLine(path, line);
    }

    /** Events recorded by this run, in append order. */
    public List<Map<String, Object>> read() {
        return readRun(path, Path.of(runDir));
    }

    /**
     * Drops every line recorded by this run and keeps the others untouched.
     */
    public void discardRun() {
        if (!Files.isRegularFile(path)) {
            return;
        }
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> event : JsonFiles.readLines(path)) {
            if (!runDir.equals(event.get(RUN_DIR))) {
                kept.add(event);
            }
        }
        StringBuilder body = new StringBuilder();
        for (Map<String, Object> event : kept) {
            body.append(JsonFiles.toLine(event)).append('\n');
        }
        try {
            Files.writeString(path, body.toString(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to rewrite trace " + path, ex);
        }
    }

    public Path path() {
        return path;
    }

    public static List<Map<String, Object>> readRun(Path tracePath, Path runDir) {
        String owner = runDir.toAbsolutePath().normalize().toString();
        List<Map<String, Object>> events = new ArrayList<>();
        if (!Files.isRegularFile(tracePath)) {
            return events;
        }
        for (Map<String, Object> event : JsonFiles.readLines(tracePath)) {
            Object eventRun = event.get(RUN_DIR);
            if (eventRun == null || owner.equals(eventRun)) {
                events.add(event);
            }
        }
        return events;
    }
}
