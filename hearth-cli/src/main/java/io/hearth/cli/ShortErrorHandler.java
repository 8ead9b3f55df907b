package io.hearth.cli;

import picocli.CommandLine;

/**
 * Prints one line per failure: the subcommand name and the innermost cause's message.
 * Stack traces are shown only with {@code -Dhearth.debug=true}.
 */
public final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "hearth.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String line = commandLine.getCommandName() + ": " + describe(ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        } else {
            commandLine.getErr().println("Run with -D" + DEBUG_PROPERTY + "=true for the stack trace.");
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            return root.getClass().getSimpleName();
        }
        return root == error ? message : message + " (" + root.getClass().getSimpleName() + ")";
    }
}
