package work.lcod.rlm.trace;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replay-relevant facts of one run: the ordered subcall response hashes and the final artifact digest.
 */
public record RunSummary(
    String runDir,
    String mode,
    String status,
    String stopReason,
    String tracePath,
    List<String> responseHashes,
    String finalArtifact,
    String finalArtifactSha256
) {
    public RunSummary {
        responseHashes = List.copyOf(responseHashes);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("final_artifact", finalArtifact);
        map.put("final_artifact_sha256", finalArtifactSha256);
        map.put("mode", mode);
        map.put("response_hash_count", responseHashes.size());
        map.put("response_hashes", responseHashes);
        map.put("run_dir", runDir);
        map.put("status", status);
        map.put("stop_reason", stopReason);
        map.put("trace_path", tracePath);
        return map;
    }
}
