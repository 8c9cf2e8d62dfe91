package work.lcod.rlm.bundle;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;
import work.lcod.rlm.task.Task;

/**
 * Builds the deterministic context bundle of a task: {@code manifest.json}, {@code chunks.jsonl} and
 * {@code bundle.meta.json} under {@code <outputRoot>/<taskId>/}. Rebuilding from unchanged sources rewrites
 * byte-identical files.
 */
public final class BundleBuilder {
    public static final String MANIFEST_FILE = "manifest.json";
    public static final String CHUNKS_FILE = "chunks.jsonl";
    public static final String META_FILE = "bundle.meta.json";

    private static final Logger log = LoggerFactory.getLogger(BundleBuilder.class);

    private BundleBuilder() {}

    public static BuildSummary build(Task task, Path workspaceRoot, Path outputRoot) {
        String strategyName = task.bundle().chunkingStrategy();
        ChunkingStrategy strategy = ChunkingStrategies.lookup(strategyName);
        int maxChars = task.bundle().maxChars();

        List<SourceFile> files = SourceResolver.resolve(task.contextSources(), workspaceRoot);
        if (files.isEmpty()) {
            throw new BundleException("No files resolved from task.context_sources after include/exclude filtering.");
        }

        Path bundleDir = outputRoot.toAbsolutePath().normalize().resolve(task.taskId());
        List<Map<String, Object>> manifestSources = new ArrayList<>();
        int chunkCount = 0;
        long totalChars = 0;

        try {
            Files.createDirectories(bundleDir);
            try (BufferedWriter writer = Files.newBufferedWriter(bundleDir.resolve(CHUNKS_FILE), StandardCharsets.UTF_8)) {
                for (SourceFile file : files) {
                    byte[] raw = Files.readAllBytes(file.absolutePath());
                    String text = new String(raw, StandardCharsets.UTF_8);

                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("path", file.relativePath());
                    entry.put("sha256", Hashing.sha256(raw));
                    entry.put("size_bytes", raw.length);
                    manifestSources.add(entry);

                    for (ChunkSlice slice : strategy.split(text, maxChars)) {
                        chunkCount++;
                        int chars = slice.text().codePointCount(0, slice.text().length());
                        totalChars += chars;
                        Chunk chunk = new Chunk(
                            formatChunkId(chunkCount),
                            file.relativePath(),
                            slice.lineStart(),
                            slice.lineEnd(),
                            slice.text(),
                            chars,
                            Hashing.sha256(slice.text())
                        );
                        writer.write(JsonFiles.toLine(chunk.toRecord()));
                        writer.write('\n');
                    }
                }
            }
        } catch (IOException ex) {
            throw new BundleException("Unable to build bundle for task " + task.taskId() + ": " + ex.getMessage(), ex);
        }

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("chunking_strategy", strategy.name());
        manifest.put("max_chars", maxChars);
        manifest.put("sources", manifestSources);
        manifest.put("task_id", task.taskId());
        Path manifestPath = bundleDir.resolve(MANIFEST_FILE);
        JsonFiles.writePretty(manifestPath, manifest);

        String manifestSha = Hashing.sha256(manifestPath);
        var summary = new BuildSummary(bundleDir, task.taskId(), manifestSources.size(), chunkCount, totalChars, manifestSha);
        Map<String, Object> meta = summary.toMap();
        meta.remove("bundle_dir");
        JsonFiles.writePretty(bundleDir.resolve(META_FILE), meta);

        log.info("Built bundle {} ({} sources, {} chunks)", bundleDir, manifestSources.size(), chunkCount);
        return summary;
    }

    static String formatChunkId(int ordinal) {
        return String.format("%08d", ordinal);
    }
}
