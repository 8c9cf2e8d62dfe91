package work.lcod.rlm.task;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps each key name to the first line it appears on, so diagnostics can point at a line.
 */
public final class LineIndex {
    private static final Pattern JSON_KEY = Pattern.compile("\"([^\"\\\\]+)\"\\s*:");
    private static final Pattern YAML_KEY = Pattern.compile("^\\s*(?:-\\s+)?[\"']?([A-Za-z_][\\w-]*)[\"']?\\s*:");

    private final Map<String, Integer> lines;

    private LineIndex(Map<String, Integer> lines) {
        this.lines = lines;
    }

    public static LineIndex empty() {
        return new LineIndex(Map.of());
    }

    public static LineIndex of(String raw, boolean yaml) {
        Pattern pattern = yaml ? YAML_KEY : JSON_KEY;
        Map<String, Integer> index = new HashMap<>();
        String[] rows = raw.split("\\R", -1);
        for (int i = 0; i < rows.length; i++) {
            Matcher matcher = pattern.matcher(rows[i]);
            if (matcher.find()) {
                index.putIfAbsent(matcher.group(1), i + 1);
            }
        }
        return new LineIndex(index);
    }

    /**
     * Resolves the line of the leaf key of a field path such as {@code provider_policy.fallback[1]}.
     */
    public int lineFor(String field) {
        String[] parts = field.split("\\.");
        String leaf = parts[parts.length - 1];
        int bracket = leaf.indexOf('[');
        if (bracket >= 0) {
            leaf = leaf.substring(0, bracket);
        }
        return lines.getOrDefault(leaf, 1);
    }
}
