package work.lcod.rlm.task;

import java.util.Locale;
import java.util.Objects;

/**
 * Trace destination and redaction mode. Only {@code none} lets prompt/response text into the trace.
 */
public record TraceConfig(String tracePath, String redactionMode) {
    public static final String REDACTION_NONE = "none";

    public TraceConfig {
        Objects.requireNonNull(tracePath, "tracePath");
        Objects.requireNonNull(redactionMode, "redactionMode");
    }

    public boolean recordsText() {
        return REDACTION_NONE.equals(redactionMode.strip().toLowerCase(Locale.ROOT));
    }
}
