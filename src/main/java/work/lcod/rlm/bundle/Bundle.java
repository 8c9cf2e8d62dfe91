package work.lcod.rlm.bundle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;

/**
 * A bundle loaded into memory, with its fingerprint computed once from the manifest and chunk stream bytes.
 */
public final class Bundle {
    private static final byte[] FINGERPRINT_SEPARATOR = "\n--\n".getBytes(StandardCharsets.UTF_8);

    private final Path directory;
    private final String taskId;
    private final List<Chunk> chunks;
    private final Map<String, Chunk> chunksById;
    private final List<String> sources;
    private final String fingerprint;

    private Bundle(Path directory, String taskId, List<Chunk> chunks, String fingerprint) {
        this.directory = directory;
        this.taskId = taskId;
        this.chunks = Collections.unmodifiableList(chunks);
        Map<String, Chunk> byId = new LinkedHashMap<>();
        TreeSet<String> sourceNames = new TreeSet<>();
        for (Chunk chunk : chunks) {
            byId.put(chunk.chunkId(), chunk);
            sourceNames.add(chunk.source());
        }
        this.chunksById = Collections.unmodifiableMap(byId);
        this.sources = List.copyOf(sourceNames);
        this.fingerprint = fingerprint;
    }

    public static Bundle load(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        Path manifestPath = dir.resolve(BundleBuilder.MANIFEST_FILE);
        Path chunksPath = dir.resolve(BundleBuilder.CHUNKS_FILE);
        if (!Files.isRegularFile(manifestPath) || !Files.isRegularFile(chunksPath)) {
            throw new BundleException("Bundle fingerprint requires manifest/chunks files in " + dir);
        }
        String fingerprint = fingerprint(dir);
        List<Map<String, Object>> records = JsonFiles.readLines(chunksPath);
        List<Chunk> chunks = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            chunks.add(Chunk.fromRecord(records.get(i), i + 1));
        }
        Object taskId = JsonFiles.readObject(manifestPath).get("task_id");
        return new Bundle(dir, taskId == null ? "" : String.valueOf(taskId), chunks, fingerprint);
    }

    /**
     * SHA-256 over {@code manifest.json + "\n--\n" + chunks.jsonl}.
     */
    public static String fingerprint(Path directory) {
        try {
            byte[] manifest = Files.readAllBytes(directory.resolve(BundleBuilder.MANIFEST_FILE));
            byte[] chunks = Files.readAllBytes(directory.resolve(BundleBuilder.CHUNKS_FILE));
            byte[] data = new byte[manifest.length + FINGERPRINT_SEPARATOR.length + chunks.length];
            System.arraycopy(manifest, 0, data, 0, manifest.length);
            System.arraycopy(FINGERPRINT_SEPARATOR, 0, data, manifest.length, FINGERPRINT_SEPARATOR.length);
            System.arraycopy(chunks, 0, data, manifest.length + FINGERPRINT_SEPARATOR.length, chunks.length);
            return Hashing.sha256(data);
        } catch (IOException ex) {
            throw new BundleException("Unable to fingerprint bundle " + directory + ": " + ex.getMessage(), ex);
        }
    }

    public Path directory() {
        return directory;
    }

    public String taskId() {
        return taskId;
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public Chunk chunk(String chunkId) {
        return chunksById.get(chunkId);
    }

    public List<String> sources() {
        return sources;
    }

    public String fingerprint() {
        return fingerprint;
    }
}
