package work.lcod.rlm.subcall;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Append-only JSONL cache of provider responses keyed by request hash. The in-memory index is rebuilt from
 * the log on open; the last line written for a key wins.
 */
public final class SubcallCache {
    private final Path path;
    private final Map<String, CacheEntry> index = new LinkedHashMap<>();

    private SubcallCache(Path path) {
        this.path = path.toAbsolutePath().normalize();
    }

    public static SubcallCache open(Path path) {
        SubcallCache cache = new SubcallCache(path);
        if (Files.isRegularFile(cache.path)) {
            for (Map<String, Object> record : JsonFiles.readLines(cache.path)) {
                CacheEntry entry = CacheEntry.fromRecord(record);
                if (entry != null) {
                    cache.index.put(entry.requestHash(), entry);
                }
            }
        }
        return cache;
    }

    /**
     * SHA-256 of the canonical JSON {@code {"prompt": ..., "provider": ...}}. The provider is part of the key,
     * so one prompt sent to two providers never shares an entry.
     */
    public static String requestHash(String prompt, String provider) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("prompt", prompt);
        request.put("provider", provider);
        return Hashing.sha256(JsonFiles.toLine(request));
    }

    public Optional<CacheEntry> lookup(String requestHash) {
        return Optional.ofNullable(index.get(requestHash));
    }

    public CacheEntry store(String prompt, String provider, String responseText) {
        CacheEntry entry = new CacheEntry(
            requestHash(prompt, provider),
            provider,
            prompt,
            Hashing.sha256(responseText),
            responseText,
            Instant.now().toString()
        );
        JsonFiles.appendLine(path, entry.toRecord());
        index.put(entry.requestHash(), entry);
        return entry;
    }

    public int size() {
        return index.size();
    }

    public Path path() {
        return path;
    }
}
