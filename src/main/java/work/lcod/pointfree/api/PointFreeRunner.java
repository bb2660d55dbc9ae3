package work.lcod.pointfree.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import work.lcod.pointfree.compiler.PointFreeCompiler;
import work.lcod.pointfree.error.CapabilityException;
import work.lcod.pointfree.error.CompileException;
import work.lcod.pointfree.shared.Diagnostics;

/**
 * Public entry point for embedding the compiler. Never throws for bad programs: failures come
 * back as {@link CompileResult.Status#FAILURE} results.
 */
public final class PointFreeRunner {
    public static final String DEBUG_PROPERTY = "pointfree.debug";

    public CompileResult run(CompileConfiguration configuration) {
        var started = Instant.now();
        var diagnostics = Diagnostics.stderr(configuration.logLevel());
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("source", configuration.sourceName());
        try {
            var compiler = new PointFreeCompiler(configuration.options(), diagnostics);
            var program = compiler.compile(configuration.source());
            metadata.put("emittedSteps", compiler.emittedSteps().size());
            return CompileResult.success(program, metadata, started);
        } catch (CompileException ex) {
            metadata.put("error", ex.getMessage());
            metadata.put("errorKind", ex.kind().name());
            if (ex.snippet() != null) {
                metadata.put("snippet", ex.snippet());
            }
            if (ex instanceof CapabilityException capability) {
                metadata.put("limit", capability.limit());
            }
            diagnostics.log(LogLevel.ERROR, "%s: %s", configuration.sourceName(), ex.getMessage());
            printDebugTrace(ex);
            return CompileResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            metadata.put("error", message);
            metadata.put("errorKind", CompileException.Kind.INTERNAL.name());
            diagnostics.log(LogLevel.ERROR, "%s: unexpected failure: %s", configuration.sourceName(), message);
            printDebugTrace(ex);
            return CompileResult.failure(message, metadata, started);
        }
    }

    private static void printDebugTrace(Exception ex) {
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace();
        }
    }
}
