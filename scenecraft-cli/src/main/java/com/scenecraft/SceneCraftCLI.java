package com.scenecraft;

import ch.qos.logback.classic.Level;
import com.scenecraft.cli.ConvertCommand;
import com.scenecraft.cli.GenerateCommand;
import com.scenecraft.cli.InitCommand;
import com.scenecraft.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for SceneCraft.
 *
 * <p>SceneCraft builds a hierarchical tree of scene elements (rooms, furniture,
 * characters, props) for a script excerpt by repeatedly asking a chat model to
 * expand containers.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate a scene</li>
 *   <li>{@code convert} - Convert a saved JSON scene to markdown or text</li>
 *   <li>{@code list} - List example scenes or output formats</li>
 *   <li>{@code init} - Write a starter {@code scenecraft.yaml}</li>
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
 * # Write a starter configuration
 * scenecraft init
 *
 * # Generate a built-in example with the round-based loop
 * scenecraft generate --example ancient_study --rounds --output study.json
 *
 * # Convert it to text
 * scenecraft convert study.json --format text
 * }</pre>
 */
@Command(
    name = "scenecraft",
    mixinStandardHelpOptions = true,
    version = "SceneCraft 1.0.0-SNAPSHOT",
    description = "Generates detailed scene trees for scripts using a generative model",
    subcommands = {
        GenerateCommand.class,
        ConvertCommand.class,
        ListCommand.class,
        InitCommand.class
    }
)
public class SceneCraftCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SceneCraftCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("SceneCraft - scene tree generator");
        spec.commandLine().getOut().println("Use 'scenecraft --help' to see available commands");
    }

    /**
     * Applies the global logging options before running the selected subcommand.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line.
     *
     * @return command line with the logging execution strategy installed
     */
    public static CommandLine commandLine() {
        SceneCraftCLI cli = new SceneCraftCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
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
