package work.lcod.pointfree.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pointfree.api.CompileConfiguration;
import work.lcod.pointfree.api.CompileResult;
import work.lcod.pointfree.api.LogLevel;
import work.lcod.pointfree.api.OutputFormat;
import work.lcod.pointfree.api.PointFreeRunner;
import work.lcod.pointfree.compiler.CompilerOptions;
import work.lcod.pointfree.config.CompilerConfigLoader;
import work.lcod.pointfree.config.CompilerSettings;

@CommandLine.Command(
    name = "pointfree-compile",
    description = "Compile 'name(in) := expression' programs into point-free operator card steps.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CompileCommand implements Callable<Integer> {
    private record Source(String name, String text) {}

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-e", "--expression"},
        paramLabel = "PROGRAM",
        description = "Program text, e.g. \"f(in) := g(in)\". May be repeated."
    )
    private List<String> expressions = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--file"},
        paramLabel = "PATH|-",
        description = "File holding one program; use '-' to read from stdin. May be repeated."
    )
    private List<String> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--config",
        description = "TOML settings file (default: ./" + CompilerConfigLoader.DEFAULT_FILE_NAME + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configPath;

    @CommandLine.Option(
        names = "--format",
        description = "Output format (text|json|yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--no-comments",
        description = "Omit step comments."
    )
    private boolean noComments;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum expression nesting depth.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        var sources = collectSources();
        if (sources.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --expression or --file is required.");
        }

        CompilerSettings settings = loadSettings();
        OutputFormat format = formatRaw != null ? parseOption(() -> OutputFormat.from(formatRaw)) : settings.outputFormat();
        LogLevel logLevel = logLevelRaw != null ? parseOption(() -> LogLevel.from(logLevelRaw)) : settings.logLevel();
        CompilerOptions options = applyOverrides(settings.options());

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        var runner = new PointFreeRunner();
        int exitCode = 0;
        boolean first = true;

        for (Source source : sources) {
            var configuration = CompileConfiguration.builder()
                .source(source.text())
                .sourceName(source.name())
                .options(options)
                .logLevel(logLevel)
                .build();
            CompileResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());

            if (format == OutputFormat.TEXT) {
                if (!first) {
                    out.println();
                }
                if (sources.size() > 1) {
                    out.println("# " + source.name());
                }
                var target = result.isSuccess() ? out : err;
                result.toTextLines().forEach(target::println);
            } else {
                out.println(result.render(format));
            }
            first = false;
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    private List<Source> collectSources() {
        var sources = new ArrayList<Source>();
        for (int i = 0; i < expressions.size(); i++) {
            String name = expressions.size() == 1 ? CompileConfiguration.INLINE_SOURCE : "<inline#" + (i + 1) + ">";
            sources.add(new Source(name, expressions.get(i)));
        }
        for (String file : files) {
            sources.add(readSource(file));
        }
        return sources;
    }

    private Source readSource(String file) {
        if ("-".equals(file)) {
            try {
                return new Source("<stdin>", new String(System.in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        Path path = Paths.get(file).toAbsolutePath().normalize();
        try {
            return new Source(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read program file: " + path);
        }
    }

    private CompilerSettings loadSettings() {
        Path path = configPath != null
            ? Paths.get(configPath).toAbsolutePath().normalize()
            : Paths.get(CompilerConfigLoader.DEFAULT_FILE_NAME).toAbsolutePath().normalize();
        if (configPath != null && !Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + path);
        }
        try {
            return CompilerConfigLoader.load(path);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private CompilerOptions applyOverrides(CompilerOptions base) {
        var builder = base.toBuilder();
        if (noComments) {
            builder.emitComments(false);
        }
        if (maxDepth != null) {
            builder.maxNestingDepth(maxDepth);
        }
        return parseOption(builder::build);
    }

    private <T> T parseOption(java.util.function.Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
