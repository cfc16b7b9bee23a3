package com.exprformat;

import com.exprformat.cli.ListCommand;
import com.exprformat.cli.RenderCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for ExprFormat.
 *
 * <p>ExprFormat renders expression trees, handed over as JSON, either as indented
 * plain text or as syntax-highlighted HTML.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a JSON tree file</li>
 *   <li>{@code list} - List available formatters</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render as plain text
 * exprformat render tree.json
 *
 * # Render as HTML into a file
 * exprformat render tree.json -f html -o tree.html
 *
 * # Render with debug logging
 * exprformat -v render tree.json
 * }</pre>
 */
@Command(
    name = "exprformat",
    mixinStandardHelpOptions = true,
    version = "ExprFormat 1.0.0-SNAPSHOT",
    description = "Pretty-printer and syntax highlighter for expression trees",
    subcommands = {
        RenderCommand.class,
        ListCommand.class
    }
)
public class ExprFormatCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExprFormatCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("ExprFormat - Expression tree pretty-printer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'exprformat --help' to see available commands");
        System.out.println("Use 'exprformat <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Subcommands call this
     * before doing any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExprFormatCLI()).execute(args);
        System.exit(exitCode);
    }
}
