package work.lcod.rlm.executor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.shared.JsonFiles;

/**
 * Writes the final payload and the auxiliary run reports of a completed run.
 */
final class ArtifactWriter {
    private ArtifactWriter() {}

    /**
     * Maps and lists become pretty JSON with sorted keys; anything else is written as text. Both end with a
     * newline. Returns the SHA-256 of the written bytes.
     */
    static String writeFinal(Path path, Object payload) {
        String text;
        if (payload instanceof Map<?, ?> || payload instanceof List<?>) {
            text = JsonFiles.toPrettyJson(payload);
        } else {
            text = String.valueOf(payload) + "\n";
        }
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, bytes);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write final artifact " + path, ex);
        }
        return Hashing.sha256(bytes);
    }

    static void writeReports(List<Path> paths, Map<String, Object> report) {
        for (Path path : paths) {
            JsonFiles.writePretty(path, report);
        }
    }

    static void deleteIfPresent(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to remove stale artifact " + path, ex);
        }
    }
}
