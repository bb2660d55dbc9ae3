package work.lcod.pointfree.api;

import java.util.Locale;

/**
 * Diagnostic thresholds, from most to least verbose. {@link #FATAL} keeps the compiler quiet.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    /** Parses a level name case-insensitively; blank means {@link #FATAL}. */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (var level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + value);
    }

    /** Whether a message at {@code level} passes when this level is the threshold. */
    public boolean allows(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
