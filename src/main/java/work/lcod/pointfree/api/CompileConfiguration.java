package work.lcod.pointfree.api;

import java.util.Objects;
import work.lcod.pointfree.compiler.CompilerOptions;

/**
 * Immutable configuration for compiling one program through {@link PointFreeRunner}.
 */
public record CompileConfiguration(
    String source,
    String sourceName,
    CompilerOptions options,
    LogLevel logLevel
) {
    public static final String INLINE_SOURCE = "<inline>";

    public CompileConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String source;
        private String sourceName = INLINE_SOURCE;
        private CompilerOptions options = CompilerOptions.defaults();
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder options(CompilerOptions options) {
            this.options = options;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CompileConfiguration build() {
            return new CompileConfiguration(source, sourceName, options, logLevel);
        }
    }
}
