package com.optmodeler;

import ch.qos.logback.classic.Level;
import com.optmodeler.cli.ListCommand;
import com.optmodeler.cli.RenderCommand;
import com.optmodeler.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for OptModeler.
 *
 * <p>OptModeler turns declarative model definitions into SAS PROC OPTMODEL programs.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a model definition as an OPTMODEL program</li>
 *   <li>{@code validate} - Build a model definition and report structural errors</li>
 *   <li>{@code list} - List available generators, renderers or functions</li>
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
 * # Print the program to the console
 * optmodeler render transport.yaml
 *
 * # Write transport.sas into ./out
 * optmodeler -v render transport.yaml -o out
 * }</pre>
 */
@Command(
    name = "optmodeler",
    mixinStandardHelpOptions = true,
    version = "OptModeler 1.0.0-SNAPSHOT",
    description = "Builds optimization models and renders them as PROC OPTMODEL programs",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class OptModelerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OptModelerCLI.class);

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

        System.out.println("OptModeler - PROC OPTMODEL program builder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'optmodeler --help' to see available commands");
    }

    /**
     * Configures the root log level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        OptModelerCLI cli = new OptModelerCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
