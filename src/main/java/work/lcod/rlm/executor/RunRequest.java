package work.lcod.rlm.executor;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.rlm.api.CacheMode;

/**
 * Inputs of a fresh {@code run}. Null paths fall back to the workspace defaults; a null cache mode means
 * "not given", which is only accepted for baseline tasks.
 */
public record RunRequest(
    Path taskPath,
    Path runDir,
    Path bundleRoot,
    Path cachePath,
    CacheMode cacheMode,
    boolean fresh
) {
    public RunRequest {
        Objects.requireNonNull(taskPath, "taskPath");
    }

    public static RunRequest of(Path taskPath) {
        return new RunRequest(taskPath, null, null, null, null, false);
    }

    public RunRequest withCacheMode(CacheMode mode) {
        return new RunRequest(taskPath, runDir, bundleRoot, cachePath, mode, fresh);
    }

    public RunRequest withRunDir(Path dir) {
        return new RunRequest(taskPath, dir, bundleRoot, cachePath, cacheMode, fresh);
    }

    public RunRequest withFresh(boolean value) {
        return new RunRequest(taskPath, runDir, bundleRoot, cachePath, cacheMode, value);
    }
}
