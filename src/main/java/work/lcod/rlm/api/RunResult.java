package work.lcod.rlm.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Outcome of an {@link RlmRunner} call (usable by the CLI and embedding apps). {@code metadata} is the JSON
 * status summary printed on stdout.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    /** The invocation finished but the run ended in a state reported as non-zero (for example BLOCKED). */
    public static RunResult stopped(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.STOPPED, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>(metadata);
        serializable.putIfAbsent("status", status.name());
        serializable.put("started_at", startedAt.toString());
        serializable.put("finished_at", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return JsonFiles.toPrettyJson(toSerializableMap());
        } catch (IllegalArgumentException ex) {
            return "{\"status\":\"FAILURE\",\"error\":\"" + ex.getMessage() + "\"}\n";
        }
    }

    public int exitCode() {
        return status.exitCode();
    }

    public enum Status {
        SUCCESS(0),
        STOPPED(1),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
