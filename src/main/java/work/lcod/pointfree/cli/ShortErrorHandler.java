package work.lcod.pointfree.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.lcod.pointfree.api.PointFreeRunner;
import work.lcod.pointfree.error.CompileException;

/**
 * Prints a single line for unexpected failures, tagged with the compile error kind when known.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(PointFreeRunner.DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof CompileException compile) {
            return compile.kind().name().toLowerCase(Locale.ROOT) + " error: " + message;
        }
        return message;
    }
}
