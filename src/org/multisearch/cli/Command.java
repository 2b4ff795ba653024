/*
 * @LICENSE@
 */
package org.multisearch.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

/**
 * An action to execute within a cli.
 */
public abstract class Command {

    /** A description of the command, used in the help output. */
    protected final String description;

    /** The option parser for this command. */
    protected final OptionParser parser = new OptionParser();

    private final OptionSpec<Void> helpOption =
            parser.acceptsAll(Arrays.asList("h", "help"), "show help").forHelp();

    public Command(String description) {
        this.description = description;
    }

    /**
     * Parses options for this command from args and executes it. User errors
     * are reported on <code>err</code>; anything else propagates.
     *
     * @return the exit status.
     */
    public final int main(String[] args, PrintWriter out, PrintWriter err) throws Exception {
        try {
            final OptionSet options;
            try {
                options = parser.parse(args);
            } catch (OptionException e) {
                printHelp(err);
                err.println("ERROR: " + e.getMessage());
                return ExitCodes.USAGE;
            }

            if (options.has(helpOption)) {
                printHelp(out);
                return ExitCodes.OK;
            }

            try {
                execute(options, out, err);
            } catch (OptionException e) {
                printHelp(err);
                err.println("ERROR: " + e.getMessage());
                return ExitCodes.USAGE;
            } catch (UserError e) {
                if (e.exitCode == ExitCodes.USAGE) {
                    printHelp(err);
                }
                err.println("ERROR: " + e.getMessage());
                return e.exitCode;
            }
            return ExitCodes.OK;
        } finally {
            out.flush();
            err.flush();
        }
    }

    /** Prints a help message for the command. */
    private void printHelp(PrintWriter pw) throws IOException {
        pw.println(description);
        pw.println();
        printAdditionalHelp(pw);
        parser.printHelpOn(pw);
        pw.flush();
    }

    /** Prints additional help information, specific to the command */
    protected void printAdditionalHelp(PrintWriter pw) {}

    protected static void exit(int status) {
        System.exit(status);
    }

    /**
     * Executes this command.
     *
     * Any runtime user errors (like an input file that does not exist), should
     * throw a {@link UserError}.
     */
    protected abstract void execute(OptionSet options, PrintWriter out, PrintWriter err) throws Exception;
}
