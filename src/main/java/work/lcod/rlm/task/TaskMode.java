package work.lcod.rlm.task;

import java.util.Locale;

/**
 * Execution mode of a task: {@code baseline} forbids external calls, {@code subcalls} allows budgeted ones.
 */
public enum TaskMode {
    BASELINE,
    SUBCALLS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static boolean isKnown(String value) {
        for (TaskMode mode : values()) {
            if (mode.wireName().equals(value)) {
                return true;
            }
        }
        return false;
    }

    public static TaskMode from(String value) {
        if (value == null || !isKnown(value)) {
            throw new IllegalArgumentException("Unsupported mode: " + value);
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
