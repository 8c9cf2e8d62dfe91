package work.lcod.rlm.task;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a task document violates the schema. Carries every diagnostic found.
 */
public final class TaskValidationException extends RuntimeException {
    private final String source;
    private final List<Diagnostic> diagnostics;

    public TaskValidationException(String source, List<Diagnostic> diagnostics) {
        super(render(source, diagnostics));
        this.source = source;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String source() {
        return source;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    private static String render(String source, List<Diagnostic> diagnostics) {
        return "INVALID: " + source + "\n" + diagnostics.stream()
            .map(diag -> diag.render(source))
            .collect(Collectors.joining("\n"));
    }
}
