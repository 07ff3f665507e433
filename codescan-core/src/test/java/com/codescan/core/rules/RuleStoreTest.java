package com.codescan.core.rules;

import com.codescan.core.config.RuleDbSettings;
import com.codescan.core.model.RulePattern;
import com.codescan.core.model.RuleSource;
import com.codescan.core.model.Severity;
import com.codescan.core.rules.importer.RuleFetchException;
import com.codescan.core.rules.importer.RuleImporter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RuleStore}.
 */
class RuleStoreTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path storeDir;
    private RuleDbSettings settings;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        storeDir = tempDir.resolve("vulndb");
        settings = RuleDbSettings.local(storeDir);
    }

    private RuleStore store(RuleFeed feed) {
        RuleStore store = new RuleStore(settings, feed, new RuleImporter(), clock);
        store.load();
        return store;
    }

    private RuleStore store() {
        return store(url -> {
            throw new RuleFetchException("offline");
        });
    }

    private static RulePattern rule(String id, String pattern) {
        return new RulePattern(id, "name " + id, pattern, "desc " + id, Severity.MEDIUM,
            Set.of("python"), RuleSource.USER, Map.of());
    }

    @Test
    void load_missingStore_installsAndSavesDefaultRules() {
        // When
        RuleStore store = store();

        // Then
        assertThat(store.buckets()).containsOnlyKeys("common", "python", "javascript", "java");
        assertThat(store.ruleCount()).isEqualTo(8);
        assertThat(storeDir.resolve(RuleStore.RULES_FILE)).exists();
        assertThat(storeDir.resolve(RuleStore.LAST_UPDATE_FILE)).exists();
        assertThat(store.getPatternsFor("python")).allMatch(rule -> rule.source() == RuleSource.BUILTIN);
    }

    @Test
    void load_corruptStore_fallsBackToDefaults() throws IOException {
        Files.createDirectories(storeDir);
        Files.writeString(storeDir.resolve(RuleStore.RULES_FILE), "{ not json");

        RuleStore store = store();

        assertThat(store.ruleCount()).isEqualTo(8);
    }

    @Test
    void load_existingStore_keepsStoredRules() throws IOException {
        // Given
        Files.createDirectories(storeDir);
        Files.writeString(storeDir.resolve(RuleStore.RULES_FILE), """
            {"Go": [{"id": "go-1", "pattern": "exec\\\\.Command", "severity": "high"}]}
            """);

        // When
        RuleStore store = store();

        // Then
        assertThat(store.buckets()).containsOnlyKeys("go");
        assertThat(store.getPatternsFor("GO")).singleElement().satisfies(rule -> {
            assertThat(rule.pattern()).isEqualTo("exec\\.Command");
            assertThat(rule.severity()).isEqualTo(Severity.HIGH);
        });
    }

    @Test
    void getPatternsFor_returnsCommonThenLanguageRules() {
        RuleStore store = store();

        List<RulePattern> python = store.getPatternsFor("Python");

        assertThat(python).extracting(RulePattern::id)
            .containsExactly("common-1", "common-2", "common-3", "python-1", "python-2");
        assertThat(store.getPatternsFor("common")).hasSize(3);
        assertThat(store.getPatternsFor("cobol")).hasSize(3);
    }

    @Test
    void getPatternsFor_returnsIndependentCopy() {
        RuleStore store = store();

        store.getPatternsFor("python").clear();

        assertThat(store.getPatternsFor("python")).hasSize(5);
    }

    @Test
    void merge_newIds_areAppendedAndCounted() {
        RuleStore store = store();

        int added = store.merge(Map.of("python", List.of(rule("py-new-1", "a"), rule("py-new-2", "b"))));

        assertThat(added).isEqualTo(2);
        assertThat(store.buckets().get("python")).extracting(RulePattern::id)
            .containsExactly("python-1", "python-2", "py-new-1", "py-new-2");
    }

    @Test
    void merge_sameRulesTwice_isIdempotent() {
        RuleStore store = store();
        Map<String, List<RulePattern>> batch = Map.of("python", List.of(rule("x-1", "a"), rule("x-2", "b")));

        store.merge(batch);
        Map<String, List<RulePattern>> afterFirst = store.buckets();
        int addedAgain = store.merge(batch);

        assertThat(addedAgain).isZero();
        assertThat(store.buckets()).isEqualTo(afterFirst);
    }

    @Test
    void merge_existingIdWithNewPattern_replacesWithoutCounting() {
        RuleStore store = store();

        int added = store.merge(Map.of("python", List.of(rule("python-1", "pickle\\.dumps"))));

        assertThat(added).isZero();
        assertThat(store.buckets().get("python").get(0).pattern()).isEqualTo("pickle\\.dumps");
        assertThat(store.buckets().get("python").get(0).description()).isEqualTo("desc python-1");
    }

    @Test
    void merge_existingIdWithOnlyOtherFieldsChanged_keepsStoredRule() {
        RuleStore store = store();
        RulePattern stored = store.buckets().get("python").get(0);
        RulePattern changed = new RulePattern(stored.id(), "renamed", stored.pattern(), "other description",
            Severity.LOW, stored.languages(), stored.source(), stored.metadata());

        store.merge(Map.of("python", List.of(changed)));

        assertThat(store.buckets().get("python").get(0)).isEqualTo(stored);
    }

    @Test
    void merge_existingIdWithEmptyPattern_keepsStoredRule() {
        RuleStore store = store();
        RulePattern stored = store.buckets().get("python").get(0);

        store.merge(Map.of("python", List.of(rule("python-1", ""))));

        assertThat(store.buckets().get("python").get(0)).isEqualTo(stored);
    }

    @Test
    void merge_rulesWithoutId_receiveSequentialIds() {
        // Given
        RuleStore store = store();

        // When
        int added = store.merge(Map.of("python", List.of(rule("", "a"), rule("", "b"))));

        // Then
        assertThat(added).isEqualTo(2);
        assertThat(store.buckets().get("python")).extracting(RulePattern::id)
            .containsExactly("python-1", "python-2", "python-0003", "python-0005");
    }

    @Test
    void merge_emptyIncomingBucket_isNotCreated() {
        RuleStore store = store();

        store.merge(Map.of("rust", List.of()));

        assertThat(store.buckets()).doesNotContainKey("rust");
    }

    @Test
    void update_feedSucceeds_replacesWholeStore() throws IOException {
        // Given
        AtomicInteger calls = new AtomicInteger();
        RuleStore store = store(url -> {
            calls.incrementAndGet();
            return Map.of("Ruby", List.of(rule("ruby-1", "system\\(")));
        });

        // When
        boolean updated = store.update();

        // Then
        assertThat(updated).isTrue();
        assertThat(calls).hasValue(1);
        assertThat(store.buckets()).containsOnlyKeys("ruby");
        JsonNode lastUpdate = MAPPER.readTree(storeDir.resolve(RuleStore.LAST_UPDATE_FILE).toFile());
        assertThat(lastUpdate.get("last_update").asLong()).isEqualTo(NOW.getEpochSecond());
        assertThat(store.isUpdateDue()).isFalse();
    }

    @Test
    void update_feedFails_leavesStoreUntouched() {
        RuleStore store = store();
        Map<String, List<RulePattern>> before = store.buckets();

        assertThat(store.update()).isFalse();
        assertThat(store.buckets()).isEqualTo(before);
    }

    @Test
    void isUpdateDue_staleRecord_returnsTrue() throws IOException {
        RuleStore store = store();
        long eightDaysAgo = NOW.minus(Duration.ofDays(8)).getEpochSecond();
        Files.writeString(storeDir.resolve(RuleStore.LAST_UPDATE_FILE), "{\"last_update\": " + eightDaysAgo + "}");

        assertThat(store.isUpdateDue()).isTrue();
    }

    @Test
    void isUpdateDue_missingRecord_returnsTrue() throws IOException {
        RuleStore store = store();
        Files.delete(storeDir.resolve(RuleStore.LAST_UPDATE_FILE));

        assertThat(store.isUpdateDue()).isTrue();
    }

    @Test
    void open_autoUpdateWithMissingRecord_fetchesFeed() throws IOException {
        // Given
        Files.createDirectories(storeDir);
        Files.writeString(storeDir.resolve(RuleStore.RULES_FILE), "{\"python\": []}");
        RuleDbSettings autoUpdating = new RuleDbSettings(storeDir.toString(), "http://feed.invalid/rules.json", true, 7);
        AtomicInteger calls = new AtomicInteger();
        RuleFeed feed = url -> {
            calls.incrementAndGet();
            assertThat(url).isEqualTo("http://feed.invalid/rules.json");
            return Map.of("php", List.of(rule("php-1", "eval")));
        };

        // When
        RuleStore store = RuleStore.open(autoUpdating, feed, clock);

        // Then
        assertThat(calls).hasValue(1);
        assertThat(store.buckets()).containsOnlyKeys("php");
    }

    @Test
    void open_autoUpdateOff_neverFetches() {
        RuleStore store = RuleStore.open(settings, url -> {
            throw new AssertionError("feed must not be called");
        }, clock);

        assertThat(store.ruleCount()).isEqualTo(8);
    }

    @Test
    void importDirectory_yamlRules_areMergedAndPersisted() throws IOException {
        // Given
        Path rules = Files.createDirectories(tempDir.resolve("rules"));
        Files.writeString(rules.resolve("go.yaml"), """
            rules:
              - id: go-exec
                message: Command built from input
                severity: ERROR
                languages: [go]
                pattern: exec.Command($CMD)
            """);
        RuleStore store = store();

        // When
        RuleImportResult result = store.importDirectory(rules);

        // Then
        assertThat(result).isEqualTo(RuleImportResult.succeeded(1));
        RuleStore reopened = store();
        assertThat(reopened.getPatternsFor("go")).extracting(RulePattern::id).contains("go-exec");
    }

    @Test
    void importDirectory_missingDirectory_fails() {
        RuleStore store = store();

        RuleImportResult result = store.importDirectory(tempDir.resolve("does-not-exist"));

        assertThat(result.success()).isFalse();
        assertThat(result.added()).isZero();
    }

    @Test
    void importRules_jsonBatch_isMerged() {
        RuleStore store = store();

        RuleImportResult result = store.importRules(Map.of("kotlin", List.of(rule("kt-1", "Runtime\\.exec"))));

        assertThat(result.success()).isTrue();
        assertThat(result.added()).isEqualTo(1);
        assertThat(store.getPatternsFor("kotlin")).extracting(RulePattern::id).contains("kt-1");
    }

    @Test
    void addRule_duplicateId_isRejected() throws IOException {
        RuleStore store = store();

        assertThat(store.addRule("python", rule("custom-1", "yaml\\.load"))).isTrue();
        assertThat(store.addRule("python", rule("custom-1", "other"))).isFalse();
        assertThatThrownBy(() -> store.addRule("python", rule("", "x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeRule_lastRuleOfBucket_dropsBucket() throws IOException {
        RuleStore store = store();

        assertThat(store.removeRule("java", "java-1")).isTrue();
        assertThat(store.removeRule("java", "java-1")).isFalse();
        assertThat(store.buckets()).doesNotContainKey("java");
    }

    @Test
    void exportTo_singleBucket_writesStoreFormat() throws IOException {
        // Given
        RuleStore store = store();
        Path target = tempDir.resolve("export/java.json");

        // When
        store.exportTo(target, "JAVA");

        // Then
        JsonNode exported = MAPPER.readTree(target.toFile());
        assertThat(exported.size()).isEqualTo(1);
        assertThat(exported.get("java").get(0).get("id").asText()).isEqualTo("java-1");
        assertThat(exported.get("java").get(0).get("source").asText()).isEqualTo("builtin");
    }
}
