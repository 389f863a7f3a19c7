package com.tabularmeta;

import ch.qos.logback.classic.Level;
import com.tabularmeta.cli.ListCommand;
import com.tabularmeta.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for tabular-meta.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Read all tables of a metadata document and check keys</li>
 *   <li>{@code list} - List the supported datatypes</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * tabular-meta -v validate data/metadata.json
 * tabular-meta list datatypes
 * }</pre>
 */
@Command(
    name = "tabular-meta",
    mixinStandardHelpOptions = true,
    version = "tabular-meta 1.0.0-SNAPSHOT",
    description = "Validates CSV data described by CSVW metadata",
    subcommands = {
        ValidateCommand.class,
        ListCommand.class
    }
)
public class TabularMetaCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("tabular-meta - CSVW metadata validator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'tabular-meta --help' to see available commands");
        System.out.println("Use 'tabular-meta <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options.
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
    }

    /**
     * Builds the command line with subcommands wired to this instance.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        TabularMetaCLI cli = new TabularMetaCLI();
        return new CommandLine(cli)
            .setExecutionStrategy(parseResult -> {
                cli.configureLogging();
                return new CommandLine.RunLast().execute(parseResult);
            });
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
