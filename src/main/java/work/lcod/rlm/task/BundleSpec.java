package work.lcod.rlm.task;

import java.util.Objects;

public record BundleSpec(String chunkingStrategy, int maxChars) {
    public BundleSpec {
        Objects.requireNonNull(chunkingStrategy, "chunkingStrategy");
    }
}
