package com.codescan.core.rules;

import com.codescan.core.config.RuleDbSettings;
import com.codescan.core.model.RulePattern;
import com.codescan.core.rules.importer.GitImportResult;
import com.codescan.core.rules.importer.RuleFetchException;
import com.codescan.core.rules.importer.RuleImporter;
import com.codescan.core.util.Languages;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Persistent, language-bucketed collection of {@link RulePattern}s.
 *
 * <p>The store lives in a directory holding two documents:
 * <ul>
 *   <li>{@code vulndb.json}: a mapping of bucket name to rule list</li>
 *   <li>{@code last_update.json}: {@code {"last_update": <epoch seconds>}}, written on every save</li>
 * </ul>
 * A missing or unreadable {@code vulndb.json} is replaced with the built-in default rules.
 *
 * <p>Imports merge incoming rules by id (see {@link #merge(Map)}); feed updates replace the
 * whole rule set. A failed fetch leaves the store untouched.
 *
 * <p>The orchestrator only reads the store through {@link #getPatternsFor(String)}; mutating
 * operations must not run while a scan is in progress.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleStore store = RuleStore.open(config.vulndb());
 * RuleImportResult result = store.importDirectory(Path.of("rules/python"));
 * List<RulePattern> active = store.getPatternsFor("python");
 * }</pre>
 */
public class RuleStore implements RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, List<RulePattern>>> BUCKETS = new TypeReference<>() { };

    static final String RULES_FILE = "vulndb.json";
    static final String LAST_UPDATE_FILE = "last_update.json";

    private final RuleDbSettings settings;
    private final RuleFeed feed;
    private final RuleImporter importer;
    private final Clock clock;
    private final Map<String, List<RulePattern>> buckets = new LinkedHashMap<>();

    public RuleStore(RuleDbSettings settings, RuleFeed feed, RuleImporter importer, Clock clock) {
        this.settings = settings;
        this.feed = feed;
        this.importer = importer;
        this.clock = clock;
    }

    /**
     * Opens the store with the HTTP feed, the default importer and the system clock.
     *
     * @param settings store settings
     * @return loaded, possibly refreshed store
     */
    public static RuleStore open(RuleDbSettings settings) {
        return open(settings, new HttpRuleFeed(), Clock.systemUTC());
    }

    /**
     * Opens the store: loads it, then refreshes it from the feed when auto update is on and
     * the last update is absent or older than the configured interval.
     *
     * @param settings store settings
     * @param feed feed used for refreshes
     * @param clock clock deciding staleness
     * @return loaded, possibly refreshed store
     */
    public static RuleStore open(RuleDbSettings settings, RuleFeed feed, Clock clock) {
        RuleStore store = new RuleStore(settings, feed, new RuleImporter(), clock);
        store.load();
        if (settings.autoUpdate() && store.isUpdateDue()) {
            log.info("Rule store is stale, updating from {}", settings.updateUrl());
            store.update();
        }
        return store;
    }

    /**
     * Loads {@code vulndb.json}, installing and saving the default rules when it is missing
     * or unreadable.
     */
    public synchronized void load() {
        Path rulesFile = rulesFile();
        if (Files.isRegularFile(rulesFile)) {
            try {
                Map<String, List<RulePattern>> loaded = MAPPER.readValue(rulesFile.toFile(), BUCKETS);
                replaceAll(loaded == null ? Map.of() : loaded);
                log.info("Loaded {} rules from {}", ruleCount(), rulesFile);
                return;
            } catch (IOException e) {
                log.error("Failed to read rule store {}: {}. Installing default rules.", rulesFile, e.getMessage());
            }
        } else {
            log.info("Rule store {} not found, installing default rules", rulesFile);
        }

        replaceAll(DefaultRules.create());
        try {
            save();
        } catch (IOException e) {
            log.warn("Cannot save default rules to {}: {}", rulesFile, e.getMessage());
        }
    }

    /**
     * Writes {@code vulndb.json} and the last update record.
     *
     * @throws IOException if either document cannot be written
     */
    public synchronized void save() throws IOException {
        persist(buckets);
    }

    @Override
    public synchronized List<RulePattern> getPatternsFor(String language) {
        List<RulePattern> patterns = new ArrayList<>(buckets.getOrDefault(Languages.COMMON, List.of()));
        String bucket = language == null ? "" : language.toLowerCase(Locale.ROOT);
        if (!Languages.COMMON.equals(bucket)) {
            patterns.addAll(buckets.getOrDefault(bucket, List.of()));
        }
        return patterns;
    }

    /**
     * Merges rules into the store in memory.
     *
     * <p>Per bucket, an incoming rule without id receives {@code <bucket>-NNNN} numbered after
     * the bucket size plus the rules added so far. A rule whose id is already stored replaces
     * the stored rule only when its pattern is non-empty and different; this is not counted
     * as an addition, and changes to other fields alone are ignored. New ids are appended and
     * counted. Buckets left empty are removed.
     *
     * @param incoming rules per bucket
     * @return number of rules added
     */
    public synchronized int merge(Map<String, List<RulePattern>> incoming) {
        int added = 0;
        for (Map.Entry<String, List<RulePattern>> entry : incoming.entrySet()) {
            String bucket = entry.getKey().toLowerCase(Locale.ROOT);
            List<RulePattern> existing = buckets.computeIfAbsent(bucket, key -> new ArrayList<>());

            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < existing.size(); i++) {
                index.put(existing.get(i).id(), i);
            }

            for (RulePattern rule : entry.getValue()) {
                if (rule == null) {
                    continue;
                }
                if (rule.id().isEmpty()) {
                    rule = rule.withId(synthesizeId(bucket, existing.size() + added + 1, index));
                }

                Integer position = index.get(rule.id());
                if (position != null) {
                    RulePattern stored = existing.get(position);
                    if (!rule.pattern().isEmpty() && !rule.pattern().equals(stored.pattern())) {
                        existing.set(position, rule);
                        log.debug("Updated pattern of rule {} in bucket {}", rule.id(), bucket);
                    }
                } else {
                    existing.add(rule);
                    index.put(rule.id(), existing.size() - 1);
                    added++;
                }
            }

            if (existing.isEmpty()) {
                buckets.remove(bucket);
            }
        }
        return added;
    }

    /**
     * Replaces the whole rule set with the content of the feed and saves it.
     *
     * @return true on success; false leaves the store untouched
     */
    public synchronized boolean update() {
        Map<String, List<RulePattern>> fetched;
        try {
            fetched = feed.fetch(settings.updateUrl());
        } catch (RuleFetchException e) {
            log.warn("Rule update from {} failed: {}", settings.updateUrl(), e.getMessage());
            return false;
        }

        Map<String, List<RulePattern>> replacement = normalize(fetched);
        try {
            persist(replacement);
        } catch (IOException e) {
            log.error("Cannot save updated rules: {}", e.getMessage(), e);
            return false;
        }
        replaceAll(replacement);
        log.info("Rule store updated: {} rules", ruleCount());
        return true;
    }

    /**
     * Returns true when the last update record is absent, unreadable or older than the
     * configured interval.
     *
     * @return true if an update is due
     */
    public boolean isUpdateDue() {
        Path record = settings.directoryPath().resolve(LAST_UPDATE_FILE);
        if (!Files.isRegularFile(record)) {
            return true;
        }
        try {
            JsonNode root = MAPPER.readTree(record.toFile());
            double lastUpdate = root == null ? 0 : root.path("last_update").asDouble(0);
            double now = clock.millis() / 1000.0;
            return now - lastUpdate > Duration.ofDays(settings.updateIntervalDays()).toSeconds();
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", record, e.getMessage());
            return true;
        }
    }

    /**
     * Imports dialect rules from a directory, merges and saves them.
     *
     * @param directory rule directory
     * @return import outcome
     */
    public RuleImportResult importDirectory(Path directory) {
        try {
            return mergeAndSave(importer.importDirectory(directory), directory.toString());
        } catch (IOException e) {
            log.error("Rule import from {} failed: {}", directory, e.getMessage());
            return RuleImportResult.failed();
        }
    }

    /**
     * Imports dialect rules from a URL, merges and saves them.
     *
     * @param url YAML document or ZIP archive URL
     * @return import outcome
     */
    public RuleImportResult importUrl(String url) {
        try {
            return mergeAndSave(importer.importUrl(url), url);
        } catch (RuleFetchException e) {
            log.error("Rule import from {} failed: {}", url, e.getMessage());
            return RuleImportResult.failed();
        }
    }

    /**
     * Imports dialect rules from a git repository, merges and saves them.
     *
     * @param url repository URL
     * @param branch branch to clone
     * @param languages language directories to import, or null for all
     * @return import outcome
     */
    public RuleImportResult importGitRepo(String url, String branch, List<String> languages) {
        try {
            GitImportResult imported = importer.importGitRepo(url, branch, languages);
            if (imported.count() == 0) {
                return RuleImportResult.failed();
            }
            return mergeAndSave(imported.rules(), url);
        } catch (RuleFetchException e) {
            log.error("Rule import from {} failed: {}", url, e.getMessage());
            return RuleImportResult.failed();
        }
    }

    /**
     * Merges rules already in the internal format and saves them.
     *
     * @param rules rules per bucket
     * @return import outcome
     */
    public RuleImportResult importRules(Map<String, List<RulePattern>> rules) {
        return mergeAndSave(rules, "JSON batch");
    }

    /**
     * Adds a single rule and saves the store.
     *
     * @param bucket bucket to add to
     * @param rule rule with id and pattern
     * @return false if the bucket already holds a rule with that id
     * @throws IOException if the store cannot be saved
     */
    public synchronized boolean addRule(String bucket, RulePattern rule) throws IOException {
        if (rule.id().isBlank() || rule.pattern().isBlank()) {
            throw new IllegalArgumentException("Rule id and pattern must not be empty");
        }
        List<RulePattern> rules = buckets.computeIfAbsent(bucket.toLowerCase(Locale.ROOT), key -> new ArrayList<>());
        if (rules.stream().anyMatch(existing -> existing.id().equals(rule.id()))) {
            return false;
        }
        rules.add(rule);
        save();
        return true;
    }

    /**
     * Removes a rule and saves the store.
     *
     * @param bucket bucket holding the rule
     * @param id rule id
     * @return true if a rule was removed
     * @throws IOException if the store cannot be saved
     */
    public synchronized boolean removeRule(String bucket, String id) throws IOException {
        String key = bucket.toLowerCase(Locale.ROOT);
        List<RulePattern> rules = buckets.get(key);
        if (rules == null || !rules.removeIf(rule -> rule.id().equals(id))) {
            return false;
        }
        if (rules.isEmpty()) {
            buckets.remove(key);
        }
        save();
        return true;
    }

    /**
     * Returns a snapshot of all buckets.
     *
     * @return unmodifiable bucket map
     */
    public synchronized Map<String, List<RulePattern>> buckets() {
        Map<String, List<RulePattern>> snapshot = new LinkedHashMap<>();
        buckets.forEach((bucket, rules) -> snapshot.put(bucket, List.copyOf(rules)));
        return Collections.unmodifiableMap(snapshot);
    }

    public synchronized int ruleCount() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Writes rules to a JSON file in the store format.
     *
     * @param target file to write
     * @param bucket single bucket to export, or null for all
     * @throws IOException if the file cannot be written
     */
    public synchronized void exportTo(Path target, String bucket) throws IOException {
        Map<String, List<RulePattern>> export = new LinkedHashMap<>();
        if (bucket == null) {
            export.putAll(buckets);
        } else {
            String key = bucket.toLowerCase(Locale.ROOT);
            export.put(key, buckets.getOrDefault(key, List.of()));
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(target.toFile(), export);
        log.info("Exported {} buckets to {}", export.size(), target);
    }

    private RuleImportResult mergeAndSave(Map<String, List<RulePattern>> rules, String source) {
        int added = merge(rules);
        try {
            save();
        } catch (IOException e) {
            log.error("Cannot save rules imported from {}: {}", source, e.getMessage());
            return RuleImportResult.failed();
        }
        log.info("Imported {} new rules from {}", added, source);
        return RuleImportResult.succeeded(added);
    }

    private void persist(Map<String, List<RulePattern>> rules) throws IOException {
        Path directory = settings.directoryPath();
        Files.createDirectories(directory);
        MAPPER.writeValue(directory.resolve(RULES_FILE).toFile(), rules);
        MAPPER.writeValue(directory.resolve(LAST_UPDATE_FILE).toFile(),
            Map.of("last_update", clock.millis() / 1000.0));
        log.debug("Saved {} rule buckets to {}", rules.size(), directory);
    }

    private void replaceAll(Map<String, List<RulePattern>> rules) {
        buckets.clear();
        buckets.putAll(normalize(rules));
    }

    private static Map<String, List<RulePattern>> normalize(Map<String, List<RulePattern>> rules) {
        Map<String, List<RulePattern>> normalized = new LinkedHashMap<>();
        rules.forEach((bucket, list) -> {
            if (list != null && !list.isEmpty()) {
                normalized.computeIfAbsent(bucket.toLowerCase(Locale.ROOT), key -> new ArrayList<>()).addAll(list);
            }
        });
        return normalized;
    }

    private static String synthesizeId(String bucket, int number, Map<String, Integer> taken) {
        String id = String.format(Locale.ROOT, "%s-%04d", bucket, number);
        while (taken.containsKey(id)) {
            id = String.format(Locale.ROOT, "%s-%04d", bucket, ++number);
        }
        return id;
    }

    private Path rulesFile() {
        return settings.directoryPath().resolve(RULES_FILE);
    }
}
