package com.codescan;

import com.codescan.cli.RulesCommand;
import com.codescan.cli.ScanCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CodeScan.
 *
 * <p>CodeScan scans a source tree for security vulnerabilities, combining a local regex rule
 * store with an optional language-model provider.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a file or directory</li>
 *   <li>{@code rules} - Inspect, import, update and export the rule store</li>
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
 * # Scan the current directory with the local rules only
 * codescan scan . --rules-only
 *
 * # Scan with the "openai" model profile and write a JSON report
 * codescan scan src --model openai -o report.json
 *
 * # Import Semgrep rules from a repository
 * codescan rules import-git https://github.com/returntocorp/semgrep-rules --language python
 * }</pre>
 */
@Command(
    name = "codescan",
    mixinStandardHelpOptions = true,
    version = "CodeScan 1.0.0-SNAPSHOT",
    description = "Security vulnerability scanner for source trees",
    subcommands = {
        ScanCommand.class,
        RulesCommand.class
    }
)
public class CodescanCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodescanCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("CodeScan - Security Vulnerability Scanner");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codescan --help' to see available commands");
        System.out.println("Use 'codescan <command> --help' for command-specific help");
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
     * Builds the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodescanCLI cli = new CodescanCLI();
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
