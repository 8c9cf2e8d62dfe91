package work.lcod.rlm.bundle;

import java.nio.file.Path;

/**
 * A resolved bundle input: its absolute location and its workspace-relative POSIX path.
 */
public record SourceFile(Path absolutePath, String relativePath) {}
