package work.lcod.rlm.task;

/**
 * A single schema violation: dotted field path, 1-based line hint and a readable message.
 */
public record Diagnostic(String field, int line, String message) {
    public String render(String source) {
        return source + ":" + line + ": " + message + " (field: " + field + ")";
    }
}
