package com.codescan.cli;

import com.codescan.core.config.CodescanConfig;
import com.codescan.core.config.ConfigLoader;
import com.codescan.core.config.RuleDbSettings;
import com.codescan.core.model.RulePattern;
import com.codescan.core.rules.HttpRuleFeed;
import com.codescan.core.rules.RuleImportResult;
import com.codescan.core.rules.RuleStore;
import com.codescan.core.rules.importer.RuleImporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command group managing the local rule store.
 *
 * <p>The store lives in {@code vulndb.directory} of the configuration, or in the directory
 * given with {@code --rules-dir}; both options go before the rule subcommand. Management
 * commands never trigger an automatic update.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Show all buckets, or the rules of one
 * codescan rules list
 * codescan rules list python
 * codescan rules --rules-dir ./vulndb list
 *
 * # Import Semgrep rules
 * codescan rules import-dir ./semgrep-rules/python
 * codescan rules import-url https://example.com/rules.zip
 * codescan rules import-git https://github.com/returntocorp/semgrep-rules --language python
 *
 * # Replace the store with the published rule feed
 * codescan rules update
 *
 * # Export the python bucket
 * codescan rules export python-rules.json --bucket python
 * }</pre>
 */
@Command(
    name = "rules",
    description = "Inspect, import, update and export vulnerability rules",
    mixinStandardHelpOptions = true,
    subcommands = {
        RulesCommand.ListRules.class,
        RulesCommand.ImportDir.class,
        RulesCommand.ImportUrl.class,
        RulesCommand.ImportGit.class,
        RulesCommand.Update.class,
        RulesCommand.Export.class
    }
)
public class RulesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RulesCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ~/.codescan/config.yaml)"
    )
    Path configPath = CodescanConfig.defaultConfigFile();

    @Option(
        names = {"--rules-dir"},
        description = "Rule store directory (overrides vulndb.directory)"
    )
    Path rulesDir;

    @Override
    public Integer call() {
        System.out.println("Use 'codescan rules --help' to see available rule commands");
        return 0;
    }

    /**
     * Opens the configured store without refreshing it.
     *
     * @param updateUrl feed URL overriding the configured one, or null
     * @return loaded store
     */
    RuleStore openStore(String updateUrl) {
        RuleDbSettings configured = ConfigLoader.load(configPath).vulndb();
        String directory = rulesDir != null ? rulesDir.toString() : configured.directory();
        String url = updateUrl != null ? updateUrl : configured.updateUrl();
        RuleDbSettings settings = new RuleDbSettings(directory, url, false, configured.updateIntervalDays());
        log.debug("Opening rule store at {}", settings.directoryPath());
        RuleStore store = new RuleStore(settings, new HttpRuleFeed(), new RuleImporter(), Clock.systemUTC());
        store.load();
        return store;
    }

    static int report(RuleImportResult result, String source) {
        if (!result.success()) {
            System.err.println("✗ Import from " + source + " failed");
            return 1;
        }
        System.out.println("✓ Imported " + result.added() + " new rules from " + source);
        return 0;
    }

    /**
     * Lists buckets with their rule counts, or the rules of one bucket.
     */
    @Command(name = "list", description = "List rule buckets, or the rules of one bucket", mixinStandardHelpOptions = true)
    static class ListRules implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Parameters(index = "0", arity = "0..1", description = "Bucket to show (e.g. common, python)")
        private String bucket;

        @Override
        public Integer call() {
            RuleStore store = rules.openStore(null);
            if (bucket == null) {
                System.out.println("Rule buckets:");
                System.out.println();
                for (Map.Entry<String, List<RulePattern>> entry : store.buckets().entrySet()) {
                    System.out.printf("  • %-12s %d rules%n", entry.getKey(), entry.getValue().size());
                }
                System.out.println();
                System.out.println("Total: " + store.ruleCount() + " rules");
                return 0;
            }

            List<RulePattern> patterns = store.buckets().get(bucket.toLowerCase(Locale.ROOT));
            if (patterns == null) {
                System.err.println("✗ Unknown bucket: " + bucket);
                return 1;
            }
            System.out.println("Rules in " + bucket + ":");
            System.out.println();
            for (RulePattern pattern : patterns) {
                System.out.printf("  • %s [%s] %s%n", pattern.id(), pattern.severity().value(), pattern.name());
                System.out.printf("    Pattern: %s%n", pattern.pattern());
            }
            return 0;
        }
    }

    @Command(name = "import-dir", description = "Import Semgrep-style YAML rules from a directory", mixinStandardHelpOptions = true)
    static class ImportDir implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Parameters(index = "0", description = "Directory containing .yml/.yaml rule files")
        private Path directory;

        @Override
        public Integer call() {
            return report(rules.openStore(null).importDirectory(directory), directory.toString());
        }
    }

    @Command(name = "import-url", description = "Import Semgrep-style rules from a YAML or ZIP URL", mixinStandardHelpOptions = true)
    static class ImportUrl implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Parameters(index = "0", description = "URL of a YAML document or ZIP archive")
        private String url;

        @Override
        public Integer call() {
            return report(rules.openStore(null).importUrl(url), url);
        }
    }

    @Command(name = "import-git", description = "Import Semgrep-style rules from a git repository", mixinStandardHelpOptions = true)
    static class ImportGit implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Parameters(index = "0", description = "Repository URL")
        private String url;

        @Option(names = {"-b", "--branch"}, description = "Branch to clone (default: ${DEFAULT-VALUE})", defaultValue = "develop")
        private String branch;

        @Option(names = {"-l", "--language"}, description = "Language directory to import (repeatable, default: all)")
        private List<String> languages = new ArrayList<>();

        @Override
        public Integer call() {
            List<String> selected = languages.isEmpty() ? null : languages;
            return report(rules.openStore(null).importGitRepo(url, branch, selected), url);
        }
    }

    @Command(name = "update", description = "Replace the rule store with the published rule feed", mixinStandardHelpOptions = true)
    static class Update implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Option(names = {"--url"}, description = "Feed URL (default: vulndb.update_url)")
        private String url;

        @Override
        public Integer call() {
            RuleStore store = rules.openStore(url);
            if (!store.update()) {
                System.err.println("✗ Rule update failed, store left unchanged");
                return 1;
            }
            System.out.println("✓ Rule store updated: " + store.ruleCount() + " rules");
            return 0;
        }
    }

    @Command(name = "export", description = "Export rules as JSON", mixinStandardHelpOptions = true)
    static class Export implements Callable<Integer> {

        @ParentCommand
        private RulesCommand rules;

        @Parameters(index = "0", description = "Target JSON file")
        private Path target;

        @Option(names = {"--bucket"}, description = "Export only this bucket")
        private String bucket;

        @Override
        public Integer call() {
            try {
                rules.openStore(null).exportTo(target, bucket);
                System.out.println("✓ Exported rules to: " + target.toAbsolutePath());
                return 0;
            } catch (Exception e) {
                log.error("Export failed", e);
                System.err.println("✗ Export failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
