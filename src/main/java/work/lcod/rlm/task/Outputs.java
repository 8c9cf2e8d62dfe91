package work.lcod.rlm.task;

import java.util.List;
import java.util.Objects;

public record Outputs(String finalPath, List<String> artifactPaths) {
    public Outputs {
        Objects.requireNonNull(finalPath, "finalPath");
        artifactPaths = artifactPaths == null ? List.of() : List.copyOf(artifactPaths);
    }
}
