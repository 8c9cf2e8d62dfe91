package work.lcod.rlm.trace;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.rlm.executor.ExecutorState;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Summarizes run directories from their executor state and trace, and compares two runs for replay
 * equivalence.
 */
public final class Replay {
    private Replay() {}

    public static RunSummary summary(Path runDir) {
        Path dir = runDir.toAbsolutePath().normalize();
        Path statePath = dir.resolve(ExecutorState.FILE_NAME);
        if (!Files.isRegularFile(statePath)) {
            throw new ReplayException("Missing executor state: " + statePath);
        }
        Map<String, Object> state = JsonFiles.readObject(statePath);
        Path tracePath = tracePath(dir, state);
        if (!Files.isRegularFile(tracePath)) {
            throw new ReplayException("Missing trace file: " + tracePath);
        }

        List<String> responseHashes = new ArrayList<>();
        for (Map<String, Object> event : TraceLog.readRun(tracePath, dir)) {
            if (!TraceEvents.isKind(event, TraceEvents.SUBCALL)) {
                continue;
            }
            Object hash = event.get("response_hash");
            if (hash != null && !String.valueOf(hash).isBlank()) {
                responseHashes.add(String.valueOf(hash));
            }
        }

        String finalArtifact = stringOrNull(state.get("final_artifact"));
        String finalSha = null;
        if (finalArtifact != null && Files.isRegularFile(Path.of(finalArtifact))) {
            finalSha = Hashing.sha256(Path.of(finalArtifact));
        }
        return new RunSummary(
            dir.toString(),
            stringOrNull(state.get("mode")),
            stringOrNull(state.get("status")),
            stringOrNull(state.get("stop_reason")),
            tracePath.toString(),
            responseHashes,
            finalArtifact,
            finalSha
        );
    }

    public static Comparison compare(Path runA, Path runB) {
        RunSummary first = summary(runA);
        RunSummary second = summary(runB);
        boolean hashesMatch = first.responseHashes().equals(second.responseHashes());
        boolean finalMatch = Objects.equals(first.finalArtifactSha256(), second.finalArtifactSha256());
        return new Comparison(first, second, hashesMatch, finalMatch);
    }

    public record Comparison(RunSummary runA, RunSummary runB, boolean responseHashesMatch, boolean finalArtifactMatch) {
        public boolean match() {
            return responseHashesMatch && finalArtifactMatch;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> comparisons = new LinkedHashMap<>();
            comparisons.put("final_artifact_sha256_match", finalArtifactMatch);
            comparisons.put("response_hashes_match", responseHashesMatch);
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("comparisons", comparisons);
            map.put("match", match());
            map.put("run_a", runA.toMap());
            map.put("run_b", runB.toMap());
            return map;
        }
    }

    private static Path tracePath(Path runDir, Map<String, Object> state) {
        String raw = stringOrNull(state.get("trace_path"));
        if (raw == null || raw.isBlank()) {
            return runDir.resolve("trace.jsonl");
        }
        Path path = Path.of(raw);
        return path.isAbsolute() ? path : runDir.resolve(path).normalize();
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
