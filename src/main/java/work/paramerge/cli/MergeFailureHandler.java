package work.paramerge.cli;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.paramerge.codec.ParameterFormatException;

/**
 * Reports a failed merge as one {@code paramerge: ...} line on stderr.
 *
 * <p>Format errors already name the offending source. I/O failures are reported with the file and the
 * underlying cause. {@code -Dparamerge.debug=true} appends the stack trace.
 */
final class MergeFailureHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "paramerge.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText("paramerge: " + describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof ParameterFormatException) {
            return ex.getMessage();
        }
        if (ex instanceof UncheckedIOException io) {
            return io.getMessage() + " (" + io.getCause().getClass().getSimpleName() + ": "
                + io.getCause().getMessage() + ")";
        }
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
