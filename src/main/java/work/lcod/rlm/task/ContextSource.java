package work.lcod.rlm.task;

import java.util.List;
import java.util.Objects;

/**
 * One configured content source ({@code file}, {@code dir} or {@code snapshot}) with optional glob filters.
 * Empty include/exclude lists mean "no filter".
 */
public record ContextSource(String type, String path, List<String> include, List<String> exclude) {
    public ContextSource {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(path, "path");
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }
}
