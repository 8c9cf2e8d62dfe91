package work.lcod.rlm.api;

import ch.qos.logback.classic.Level;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Engine log levels accepted on the command line. {@code FATAL} maps to Logback's {@code ERROR}.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    FATAL(Level.ERROR);

    public static final String ROOT_LOGGER = "work.lcod.rlm";

    private final Level level;

    LogLevel(Level level) {
        this.level = level;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Sets the level of the engine's logger hierarchy when Logback is the bound backend. */
    public void apply() {
        if (LoggerFactory.getLogger(ROOT_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(level);
        }
    }
}
