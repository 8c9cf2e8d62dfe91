package work.lcod.rlm.task;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A loaded task together with the file it came from and the SHA-256 of that file's bytes.
 */
public record TaskDocument(Path path, Task task, String sha256) {
    public TaskDocument {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(sha256, "sha256");
    }
}
