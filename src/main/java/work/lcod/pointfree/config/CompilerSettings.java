package work.lcod.pointfree.config;

import java.util.Objects;
import work.lcod.pointfree.api.LogLevel;
import work.lcod.pointfree.api.OutputFormat;
import work.lcod.pointfree.compiler.CompilerOptions;

/**
 * Settings read from a {@code pointfree.toml} file; command-line flags override them.
 */
public record CompilerSettings(CompilerOptions options, OutputFormat outputFormat, LogLevel logLevel) {
    public CompilerSettings {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(CompilerOptions.defaults(), OutputFormat.TEXT, LogLevel.FATAL);
    }
}
