package com.codescan.cli;

import com.codescan.CodescanCLI;
import com.codescan.core.config.CodescanConfig;
import com.codescan.core.config.ConfigLoader;
import com.codescan.core.config.ModelProfile;
import com.codescan.core.config.RuleDbSettings;
import com.codescan.core.config.ScanSettings;
import com.codescan.core.model.ScanResult;
import com.codescan.core.model.Severity;
import com.codescan.core.model.VulnerabilityIssue;
import com.codescan.core.provider.AnalysisAdapter;
import com.codescan.core.provider.AnalysisAdapterFactory;
import com.codescan.core.provider.NoOpAnalysisAdapter;
import com.codescan.core.rules.RuleStore;
import com.codescan.core.scanner.ScanOrchestrator;
import com.codescan.core.scanner.ScanProgressListener;
import com.codescan.core.serialization.ScanResultCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to scan a file or directory for vulnerabilities.
 *
 * <p>Wires the pieces of a scan together:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Open the rule store (refreshing it when auto update is due)</li>
 *   <li>Create the analysis adapter for the selected model profile</li>
 *   <li>Run the scan and print a severity summary</li>
 *   <li>Write the JSON report when requested</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Rules-only scan of the current directory
 * codescan scan --rules-only
 *
 * # Scan one file with the "anthropic" profile
 * codescan scan app/views.py --model anthropic
 *
 * # Eight workers, JSON report
 * codescan scan src --workers 8 -o report.json
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a file or directory for security vulnerabilities",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @ParentCommand
    private CodescanCLI parent;

    @Parameters(
        index = "0",
        description = "File or directory to scan (default: current directory)",
        defaultValue = "."
    )
    private Path target;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ~/.codescan/config.yaml)"
    )
    private Path configPath = CodescanConfig.defaultConfigFile();

    @Option(
        names = {"-w", "--workers"},
        description = "Number of concurrent file analyses (default: scan.max_workers)"
    )
    private Integer workers;

    @Option(
        names = {"-m", "--model"},
        description = "Model profile to use (default: ${DEFAULT-VALUE})",
        defaultValue = CodescanConfig.DEFAULT_PROFILE
    )
    private String model;

    @Option(
        names = {"--rules-only"},
        description = "Skip the model provider and match local rules only"
    )
    private boolean rulesOnly;

    @Option(
        names = {"--rules-dir"},
        description = "Rule store directory (overrides vulndb.directory, disables auto update)"
    )
    private Path rulesDir;

    @Option(
        names = {"-o", "--output"},
        description = "Write the scan result as JSON to this file"
    )
    private Path output;

    @Override
    public Integer call() {
        try {
            log.info("Starting scan of: {}", target.toAbsolutePath());
            System.out.println("Scanning: " + target.toAbsolutePath());
            System.out.println();

            // Step 0: Load configuration
            CodescanConfig config = ConfigLoader.load(configPath);

            // Step 1: Open the rule store
            RuleDbSettings ruleSettings = rulesDir != null ? RuleDbSettings.local(rulesDir) : config.vulndb();
            RuleStore rules = RuleStore.open(ruleSettings);
            System.out.println("✓ Loaded " + rules.ruleCount() + " rules from " + ruleSettings.directoryPath());

            // Step 2: Create the analysis adapter
            AnalysisAdapter adapter = createAdapter(config);
            ScanSettings settings = rulesOnly ? config.scan().withSummarizeProject(false) : config.scan();
            ScanOrchestrator orchestrator = ScanOrchestrator.create(settings, adapter, rules);

            // Step 3: Run the scan
            ScanResult result;
            if (Files.isRegularFile(target)) {
                result = orchestrator.scanFile(target);
            } else {
                int concurrency = workers != null ? workers : settings.maxWorkers();
                result = orchestrator.scanDirectory(target, concurrency, progressListener());
            }
            System.out.println("✓ Scanned " + result.stats().totalFiles() + " files ("
                + result.stats().totalLinesOfCode() + " lines)");

            // Step 4: Report
            printSummary(result);

            if (output != null) {
                ScanResultCodec.write(result, output);
                System.out.println("✓ Wrote report to: " + output.toAbsolutePath());
            }

            if (result.stats().hasError()) {
                System.err.println("✗ " + result.stats().error());
                return 1;
            }

            System.out.println();
            System.out.println("✓ Scan complete");
            return 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private AnalysisAdapter createAdapter(CodescanConfig config) {
        if (rulesOnly) {
            System.out.println("✓ Rules-only scan, model provider disabled");
            return NoOpAnalysisAdapter.INSTANCE;
        }
        ModelProfile profile = config.model(model)
            .orElseThrow(() -> new IllegalArgumentException("Unknown model profile: " + model));
        System.out.println("✓ Using model profile '" + model + "' (" + profile.provider() + ")");
        return AnalysisAdapterFactory.create(profile);
    }

    private ScanProgressListener progressListener() {
        return (message, percent) -> log.debug("[{}%] {}", percent, message);
    }

    private void printSummary(ScanResult result) {
        System.out.println();
        System.out.println("Findings: " + result.totalIssues());
        for (Map.Entry<Severity, Integer> entry : result.issuesBySeverity().entrySet()) {
            if (entry.getValue() > 0) {
                System.out.printf("  %-8s %d%n", entry.getKey().value(), entry.getValue());
            }
        }

        if (parent != null && parent.isVerbose()) {
            System.out.println();
            for (VulnerabilityIssue issue : result.findings()) {
                String location = issue.lineNumber() != null
                    ? issue.filePath() + ":" + issue.lineNumber()
                    : issue.filePath();
                System.out.printf("  [%s] %s%n    %s%n", issue.severity().value(), location, issue.description());
            }
        }
        System.out.println();
    }
}
