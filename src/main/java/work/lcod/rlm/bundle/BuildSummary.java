package work.lcod.rlm.bundle;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a bundle build; mirrors {@code bundle.meta.json} plus the bundle location.
 */
public record BuildSummary(Path bundleDir, String taskId, int sourceCount, int chunkCount, long totalChars, String manifestSha256) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("bundle_dir", bundleDir.toString());
        map.put("chunk_count", chunkCount);
        map.put("manifest_sha256", manifestSha256);
        map.put("source_count", sourceCount);
        map.put("task_id", taskId);
        map.put("total_chars", totalChars);
        return map;
    }
}
