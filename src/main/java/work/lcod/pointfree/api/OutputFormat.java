package work.lcod.pointfree.api;

import java.util.Locale;

/**
 * How compile results are printed.
 */
public enum OutputFormat {
    TEXT,
    JSON,
    YAML;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
