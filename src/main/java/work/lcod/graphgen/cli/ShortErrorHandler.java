package work.lcod.graphgen.cli;

import java.io.IOException;
import java.util.Locale;
import picocli.CommandLine;
import work.lcod.graphgen.ir.io.IrFormatException;
import work.lcod.graphgen.topology.GraphException;

/**
 * Keeps CLI failures to one line. Graphs that cannot be resolved and inputs that cannot be read get their own exit
 * codes so scripts can tell them apart from internal errors.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "graphgen.debug";
    static final int EXIT_INVALID_GRAPH = 2;
    static final int EXIT_INVALID_INPUT = 3;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof GraphException) {
            return EXIT_INVALID_GRAPH;
        }
        if (ex instanceof IrFormatException || ex instanceof IOException) {
            return EXIT_INVALID_INPUT;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof GraphException graph) {
            return graph.kind().name().toLowerCase(Locale.ROOT) + ": " + graph.getMessage();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        // file-system exceptions carry only the path
        if (ex instanceof IOException) {
            return ex.getClass().getSimpleName() + ": " + message;
        }
        return message;
    }
}
