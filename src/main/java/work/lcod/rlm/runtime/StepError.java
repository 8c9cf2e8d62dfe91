package work.lcod.rlm.runtime;

import java.util.Objects;

/**
 * Failure of step code, reported to the caller instead of being thrown.
 */
public record StepError(String kind, String message) {
    public StepError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    /** {@code "<ErrorKind>: <message>"}. */
    public String render() {
        return kind + ": " + message;
    }
}
