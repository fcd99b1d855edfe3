package com.stg2va;

import com.stg2va.cli.AnalyzeCommand;
import com.stg2va.cli.CompileCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for stg2va.
 *
 * <p>stg2va compiles Signal Transition Graphs ({@code .g} files) into Verilog-A behavioral models
 * that follow the phases of the graph and stop the simulation on the first edge the graph does
 * not allow.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile a {@code .g} file into a {@code .va} model</li>
 *   <li>{@code analyze} - Write a Markdown report of the phases of a {@code .g} file</li>
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
 * # Compile next to the input file
 * stg2va compile handshake.g
 *
 * # Observe every signal, write to a chosen file
 * stg2va compile handshake.g --all-inputs -o monitor.va
 *
 * # Inspect the phases
 * stg2va -v analyze handshake.g -o handshake.md
 * }</pre>
 */
@Command(
    name = "stg2va",
    mixinStandardHelpOptions = true,
    version = "stg2va 1.0.0-SNAPSHOT",
    description = "Compiles Signal Transition Graphs into Verilog-A behavioral models",
    subcommands = {
        CompileCommand.class,
        AnalyzeCommand.class
    }
)
public class Stg2VaCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Stg2VaCLI.class);

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

        System.out.println("stg2va - STG to Verilog-A compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'stg2va --help' to see available commands");
        System.out.println("Use 'stg2va <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Subcommands call this before doing any work.
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
        int exitCode = new CommandLine(new Stg2VaCLI()).execute(args);
        System.exit(exitCode);
    }
}
