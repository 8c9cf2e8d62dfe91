package work.lcod.rlm.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses provider timeouts written as {@code 20}, {@code 20s}, {@code 1500ms}, {@code 2m} or {@code 1h}.
 * A bare number means seconds, matching the {@code timeout_s} limit of task documents.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long unitMillis = 1_000L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            unitMillis = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * unitMillis));
    }

    public static Duration parseOrDefault(Object raw, Duration fallback) {
        if (raw instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        if (raw == null) {
            return fallback;
        }
        return parse(String.valueOf(raw)).orElse(fallback);
    }
}
