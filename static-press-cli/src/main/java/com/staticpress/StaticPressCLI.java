package com.staticpress;

import ch.qos.logback.classic.Level;
import com.staticpress.cli.BuildCommand;
import com.staticpress.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for StaticPress.
 *
 * <p>StaticPress compiles a directory of Markdown and HTML posts and pages into a static
 * blog: one page per unit plus tag, archive and latest-posts listings, an RSS feed and a
 * sitemap.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build the site</li>
 *   <li>{@code list} - List posts, pages, generators or renderers</li>
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
 * # Build the site in the current directory
 * staticpress build
 *
 * # Build with debug logging, without writing anything
 * staticpress -v build --dry-run
 *
 * # Show where every post will be published
 * staticpress list posts
 * }</pre>
 */
@Command(
    name = "staticpress",
    mixinStandardHelpOptions = true,
    version = "StaticPress 1.0.0-SNAPSHOT",
    description = "Static blog compiler",
    subcommands = {
        BuildCommand.class,
        ListCommand.class
    }
)
public class StaticPressCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("StaticPress - Static Blog Compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'staticpress --help' to see available commands");
        System.out.println("Use 'staticpress <command> --help' for command-specific help");
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
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StaticPressCLI cli = new StaticPressCLI();
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
