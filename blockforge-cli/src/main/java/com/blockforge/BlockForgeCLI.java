package com.blockforge;

import ch.qos.logback.classic.Level;
import com.blockforge.cli.BuildCommand;
import com.blockforge.cli.ListCommand;
import com.blockforge.cli.PatternCommand;
import com.blockforge.cli.ThemeCommand;
import com.blockforge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for BlockForge.
 *
 * <p>BlockForge turns page descriptions into block editor markup and design tokens into a
 * {@code theme.json} descriptor.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build every page of a site plus its theme</li>
 *   <li>{@code pattern} - Print the markup of a single section</li>
 *   <li>{@code theme} - Print a theme descriptor</li>
 *   <li>{@code list} - List sections, layouts or renderers</li>
 *   <li>{@code validate} - Check a site configuration</li>
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
 * blockforge build -c blockforge.yaml -o ./build
 * blockforge pattern hero -l split-left -f hero.yaml
 * blockforge -v list layouts
 * }</pre>
 */
@Command(
    name = "blockforge",
    mixinStandardHelpOptions = true,
    version = "BlockForge 1.0.0-SNAPSHOT",
    description = "Block markup and theme.json generator",
    subcommands = {
        BuildCommand.class,
        PatternCommand.class,
        ThemeCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class BlockForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BlockForgeCLI.class);

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

        PrintWriter out = spec.commandLine().getOut();
        out.println("BlockForge - Block markup and theme.json generator");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'blockforge --help' to see available commands");
        out.println("Use 'blockforge <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BlockForgeCLI cli = new BlockForgeCLI();
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
