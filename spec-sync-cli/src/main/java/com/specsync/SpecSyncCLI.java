package com.specsync;

import ch.qos.logback.classic.Level;
import com.specsync.cli.ListCommand;
import com.specsync.cli.StatusCommand;
import com.specsync.cli.SyncCommand;
import com.specsync.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SpecSync.
 *
 * <p>SpecSync keeps per-component requirements (spec written, code present, tests passing,
 * dependencies and children complete) in sync with a project's files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code sync} - Recompute requirements, incrementally or in full</li>
 *   <li>{@code validate} - Check the manifest, catalogue and dependency graph</li>
 *   <li>{@code status} - Show stored requirements without re-checking</li>
 *   <li>{@code list} - List component types and their requirements</li>
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
 * specsync sync --force
 * specsync -v sync --changed lib/shop/accounts.ex
 * specsync list requirements context
 * }</pre>
 */
@Command(
    name = "specsync",
    mixinStandardHelpOptions = true,
    version = "SpecSync 1.0.0-SNAPSHOT",
    description = "Incremental requirement sync for spec-driven projects",
    subcommands = {
        SyncCommand.class,
        ValidateCommand.class,
        StatusCommand.class,
        ListCommand.class
    }
)
public class SpecSyncCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SpecSyncCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("SpecSync - Incremental requirement sync");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'specsync --help' to see available commands");
        System.out.println("Use 'specsync <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
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
     * Builds the command line with logging configured before dispatch.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SpecSyncCLI cli = new SpecSyncCLI();
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
