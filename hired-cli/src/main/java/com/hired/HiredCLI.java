package com.hired;

import ch.qos.logback.classic.Level;
import com.hired.cli.ListCommand;
import com.hired.cli.RenderCommand;
import com.hired.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Hired.
 *
 * <p>Renders structured resume data (JSON or YAML) into HTML or PDF with
 * bundled or custom themes.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a resume file to a document</li>
 *   <li>{@code list} - List available formats or themes</li>
 *   <li>{@code validate} - Check a resume file and report what will be rendered</li>
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
 * # Render HTML with the default theme
 * hired render resume.json
 *
 * # Render a PDF on A4 paper with the minimal theme
 * hired render resume.yaml -f pdf -t minimal --page-size A4 -o alice.pdf
 *
 * # List themes
 * hired list themes
 * }</pre>
 */
@Command(
    name = "hired",
    mixinStandardHelpOptions = true,
    version = "Hired 1.0.0-SNAPSHOT",
    description = "Render structured resume data into themed HTML and PDF documents",
    subcommands = {
        RenderCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class HiredCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HiredCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Hired - Resume rendering");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'hired --help' to see available commands");
        System.out.println("Use 'hired <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
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
     * Creates the command line, applying the global logging options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        HiredCLI cli = new HiredCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
