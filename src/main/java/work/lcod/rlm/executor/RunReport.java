package work.lcod.rlm.executor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status summary printed after every run-type command.
 */
public record RunReport(
    Path runDir,
    String taskId,
    RunStatus status,
    StopReason stopReason,
    int cursor,
    int iteration,
    String finalArtifact,
    String tracePath,
    String cacheMode,
    int subcallsTotal
) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("cache_mode", cacheMode);
        map.put("cursor", cursor);
        map.put("final_artifact", finalArtifact);
        map.put("iteration", iteration);
        map.put("run_dir", runDir.toString());
        map.put("status", status.name());
        map.put("stop_reason", stopReason == null ? null : stopReason.name());
        map.put("subcalls_total", subcallsTotal);
        map.put("task_id", taskId);
        map.put("trace_path", tracePath);
        return map;
    }
}
