package work.lcod.pointfree.shared;

import java.io.PrintStream;
import java.util.Objects;
import work.lcod.pointfree.api.LogLevel;

/**
 * Threshold-gated diagnostics written to a print stream (stderr unless told otherwise).
 */
public final class Diagnostics {
    private static final Diagnostics SILENT = new Diagnostics(LogLevel.FATAL, System.err);

    private final LogLevel threshold;
    private final PrintStream sink;

    public Diagnostics(LogLevel threshold, PrintStream sink) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public static Diagnostics silent() {
        return SILENT;
    }

    public static Diagnostics stderr(LogLevel threshold) {
        return new Diagnostics(threshold, System.err);
    }

    public LogLevel threshold() {
        return threshold;
    }

    public boolean isEnabled(LogLevel level) {
        return threshold.allows(level);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (isEnabled(level)) {
            sink.printf("[%s] %s%n", level.name().toLowerCase(), String.format(format, args));
        }
    }

    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }
}
