package work.lcod.pointfree.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.pointfree.api.LogLevel;
import work.lcod.pointfree.api.OutputFormat;
import work.lcod.pointfree.compiler.CompilerOptions;

/**
 * Reads {@link CompilerSettings} from TOML:
 *
 * <pre>
 * [compiler]
 * comments = true
 * max_depth = 200
 * identity_card = "identity"
 * constant_card = "constant"
 *
 * [output]
 * format = "json"
 * log_level = "debug"
 * </pre>
 */
public final class CompilerConfigLoader {
    public static final String DEFAULT_FILE_NAME = "pointfree.toml";

    private CompilerConfigLoader() {}

    /** Missing file yields defaults; unreadable or invalid files fail. */
    public static CompilerSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return CompilerSettings.defaults();
        }
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read config: " + path, ex);
        }
    }

    public static CompilerSettings parse(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config " + origin + ": " + errors);
        }
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid config " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static CompilerSettings fromToml(TomlParseResult result) {
        var options = CompilerOptions.builder();
        TomlTable compiler = result.getTable("compiler");
        if (compiler != null) {
            Boolean comments = compiler.getBoolean("comments");
            if (comments != null) {
                options.emitComments(comments);
            }
            Long maxDepth = compiler.getLong("max_depth");
            if (maxDepth != null) {
                try {
                    options.maxNestingDepth(Math.toIntExact(maxDepth));
                } catch (ArithmeticException ex) {
                    throw new IllegalArgumentException("max_depth out of range: " + maxDepth, ex);
                }
            }
            String identity = compiler.getString("identity_card");
            if (identity != null) {
                options.identityCard(identity);
            }
            String constant = compiler.getString("constant_card");
            if (constant != null) {
                options.constantCard(constant);
            }
        }

        OutputFormat format = OutputFormat.TEXT;
        LogLevel logLevel = LogLevel.FATAL;
        TomlTable output = result.getTable("output");
        if (output != null) {
            format = OutputFormat.from(output.getString("format"));
            logLevel = LogLevel.from(output.getString("log_level"));
        }
        return new CompilerSettings(options.build(), format, logLevel);
    }
}
