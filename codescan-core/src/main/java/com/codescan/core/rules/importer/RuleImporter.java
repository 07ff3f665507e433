package com.codescan.core.rules.importer;

import com.codescan.core.model.RulePattern;
import com.codescan.core.util.FileUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Imports dialect rule documents from a directory, a URL or a git repository.
 *
 * <p>Each YAML file may hold several documents. A document may be shaped as:
 * <ul>
 *   <li>a list of rules</li>
 *   <li>an object with a {@code rules} list</li>
 *   <li>a single inline rule (an object with {@code id} and {@code pattern})</li>
 *   <li>an object of named sub-documents, each with a {@code rules} list or an inline
 *       {@code pattern}</li>
 * </ul>
 * Every rule is translated by {@link DialectRuleTranslator} and bucketed under each language
 * it declares. A rule that fails translation is logged and dropped; an unreadable file is
 * logged and skipped.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleImporter importer = new RuleImporter();
 * Map<String, List<RulePattern>> rules = importer.importDirectory(Path.of("semgrep-rules/python"));
 * GitImportResult fromGit = importer.importGitRepo(
 *     "https://github.com/semgrep/semgrep-rules.git", "develop", List.of("python"));
 * }</pre>
 */
public class RuleImporter {

    private static final Logger log = LoggerFactory.getLogger(RuleImporter.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Top-level repository directories that never hold rules. */
    public static final Set<String> EXCLUDED_REPOSITORY_DIRS = Set.of(".git", ".github", "tests", "docs", "__pycache__");

    static final int CLONE_ATTEMPTS = 3;

    /**
     * Pauses between clone attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final DialectRuleTranslator translator;
    private final RuleDownloader downloader;
    private final RepositoryCloner cloner;
    private final Sleeper sleeper;

    public RuleImporter() {
        this(new DialectRuleTranslator(), new RuleDownloader(), new GitCommandCloner(),
            duration -> Thread.sleep(duration.toMillis()));
    }

    public RuleImporter(
            DialectRuleTranslator translator,
            RuleDownloader downloader,
            RepositoryCloner cloner,
            Sleeper sleeper) {
        this.translator = translator;
        this.downloader = downloader;
        this.cloner = cloner;
        this.sleeper = sleeper;
    }

    /**
     * Imports every {@code *.yaml} and {@code *.yml} file below a directory.
     *
     * @param directory rule directory
     * @return translated rules per bucket, in file order
     * @throws IOException if the directory does not exist or cannot be walked
     */
    public Map<String, List<RulePattern>> importDirectory(Path directory) throws IOException {
        List<Path> files = findRuleFiles(directory);
        log.info("Found {} rule files in {}", files.size(), directory);

        Map<String, List<RulePattern>> result = new LinkedHashMap<>();
        for (Path file : files) {
            mergeInto(result, importFile(file));
        }
        log.info("Translated {} rules from {}", count(result), directory);
        return result;
    }

    /**
     * Imports a single rule file.
     *
     * @param file YAML file
     * @return translated rules per bucket, empty when the file cannot be read
     */
    public Map<String, List<RulePattern>> importFile(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            return importDocuments(input, file.toString());
        } catch (IOException e) {
            log.warn("Skipping unreadable rule file {}: {}", file, e.getMessage());
            return Map.of();
        }
    }

    /**
     * Imports rules from a URL pointing at a YAML document or a ZIP archive of documents.
     *
     * @param url rule URL, archives recognised by a {@code .zip} suffix
     * @return translated rules per bucket
     * @throws RuleFetchException if the download fails or the archive cannot be extracted
     */
    public Map<String, List<RulePattern>> importUrl(String url) throws RuleFetchException {
        byte[] body = downloader.download(url);
        if (!isZip(url)) {
            try {
                return importDocuments(new ByteArrayInputStream(body), url);
            } catch (IOException e) {
                throw new RuleFetchException("Rule document at " + url + " is not valid YAML: " + e.getMessage(), e);
            }
        }

        Path scratch = createScratch("codescan-rules-");
        try {
            unzip(body, scratch);
            return importDirectory(scratch);
        } catch (IOException e) {
            throw new RuleFetchException("Rule archive at " + url + " could not be extracted: " + e.getMessage(), e);
        } finally {
            deleteScratch(scratch);
        }
    }

    /**
     * Clones a rule repository and imports its rules.
     *
     * <p>The clone is attempted up to three times, waiting {@code attempt * 2} seconds
     * between attempts. With languages, only the matching top-level directories are
     * imported; without, every top-level directory except
     * {@link #EXCLUDED_REPOSITORY_DIRS}. The clone is always removed afterwards.
     *
     * @param url repository URL
     * @param branch branch to clone
     * @param languages language directories to import, or null/empty for all
     * @return translated rules and their count
     * @throws RuleFetchException if every clone attempt fails
     */
    public GitImportResult importGitRepo(String url, String branch, List<String> languages) throws RuleFetchException {
        Path scratch = createScratch("codescan-git-rules-");
        try {
            Path checkout = scratch.resolve("repository");
            cloneWithRetry(url, branch, checkout);

            Map<String, List<RulePattern>> result = new LinkedHashMap<>();
            if (languages != null && !languages.isEmpty()) {
                for (String language : languages) {
                    Path languageDir = checkout.resolve(language.toLowerCase(Locale.ROOT));
                    if (Files.isDirectory(languageDir)) {
                        log.info("Importing {} rules", language);
                        mergeInto(result, importDirectory(languageDir));
                    } else {
                        log.warn("Language directory not found in repository: {}", languageDir.getFileName());
                    }
                }
            } else {
                for (Path child : FileUtils.listSorted(checkout)) {
                    String name = child.getFileName().toString();
                    if (Files.isDirectory(child) && !EXCLUDED_REPOSITORY_DIRS.contains(name)) {
                        log.debug("Importing rule directory {}", name);
                        mergeInto(result, importDirectory(child));
                    }
                }
            }

            int total = count(result);
            if (total > 0) {
                log.info("Imported {} rules from {}", total, url);
            } else {
                log.warn("No usable rules found in {}", url);
            }
            return new GitImportResult(result, total);
        } catch (IOException e) {
            throw new RuleFetchException("Rules in " + url + " could not be read: " + e.getMessage(), e);
        } finally {
            deleteScratch(scratch);
        }
    }

    private void cloneWithRetry(String url, String branch, Path target) throws RuleFetchException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= CLONE_ATTEMPTS; attempt++) {
            try {
                log.info("Cloning {} (branch {}), attempt {}/{}", url, branch, attempt, CLONE_ATTEMPTS);
                cloner.cloneRepository(url, branch, target);
                return;
            } catch (IOException e) {
                lastFailure = e;
                log.warn("Clone attempt {}/{} failed: {}", attempt, CLONE_ATTEMPTS, e.getMessage());
                resetTarget(target);
            }
            if (attempt < CLONE_ATTEMPTS) {
                Duration backoff = Duration.ofSeconds(attempt * 2L);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuleFetchException("Clone of " + url + " interrupted", e);
                }
            }
        }
        throw new RuleFetchException("Could not clone " + url + " after " + CLONE_ATTEMPTS + " attempts", lastFailure);
    }

    private Map<String, List<RulePattern>> importDocuments(InputStream input, String source) throws IOException {
        Map<String, List<RulePattern>> result = new LinkedHashMap<>();
        try (MappingIterator<JsonNode> documents = YAML_MAPPER.readerFor(JsonNode.class).readValues(input)) {
            while (documents.hasNextValue()) {
                JsonNode document = documents.nextValue();
                List<JsonNode> rules = rulesOf(document);
                if (rules.isEmpty()) {
                    log.debug("No rules found in a document of {}", source);
                }
                for (JsonNode rule : rules) {
                    translateInto(result, rule, source);
                }
            }
        }
        return result;
    }

    private void translateInto(Map<String, List<RulePattern>> result, JsonNode rule, String source) {
        if (!rule.isObject()) {
            return;
        }
        try {
            RulePattern translated = translator.translate(rule);
            for (String language : translated.languages()) {
                result.computeIfAbsent(language, key -> new ArrayList<>()).add(translated);
            }
        } catch (RuleImportException e) {
            log.warn("Dropping rule {} from {}: {}", rule.path("id").asText("?"), source, e.getMessage());
        }
    }

    static List<JsonNode> rulesOf(JsonNode document) {
        List<JsonNode> rules = new ArrayList<>();
        if (document == null || document.isNull() || document.isMissingNode()) {
            return rules;
        }
        if (document.isArray()) {
            document.forEach(rules::add);
            return rules;
        }
        if (!document.isObject()) {
            return rules;
        }
        if (document.path("rules").isArray()) {
            document.get("rules").forEach(rules::add);
            return rules;
        }
        if (document.has("id") && document.has("pattern")) {
            rules.add(document);
            return rules;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject() && value.path("rules").isArray()) {
                value.get("rules").forEach(rules::add);
            } else if (value.isObject() && value.has("pattern")) {
                if (!value.has("id") && value instanceof ObjectNode named) {
                    ObjectNode copy = named.deepCopy();
                    copy.put("id", field.getKey());
                    rules.add(copy);
                } else {
                    rules.add(value);
                }
            }
        }
        return rules;
    }

    private static List<Path> findRuleFiles(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (attrs.isRegularFile() && (name.endsWith(".yaml") || name.endsWith(".yml"))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(directory)) {
                    throw exc;
                }
                log.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    static void unzip(byte[] archive, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("Archive entry escapes the target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(zip, destination);
                }
            }
        }
    }

    private static void mergeInto(Map<String, List<RulePattern>> target, Map<String, List<RulePattern>> source) {
        source.forEach((bucket, rules) -> target.computeIfAbsent(bucket, key -> new ArrayList<>()).addAll(rules));
    }

    private static int count(Map<String, List<RulePattern>> rules) {
        return rules.values().stream().mapToInt(List::size).sum();
    }

    private static boolean isZip(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        return path.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static Path createScratch(String prefix) throws RuleFetchException {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new RuleFetchException("Cannot create a scratch directory: " + e.getMessage(), e);
        }
    }

    private static void resetTarget(Path target) {
        try {
            FileUtils.deleteRecursively(target);
        } catch (IOException e) {
            log.warn("Cannot clean partial clone {}: {}", target, e.getMessage());
        }
    }

    private static void deleteScratch(Path scratch) {
        try {
            FileUtils.deleteRecursively(scratch);
            log.debug("Removed scratch directory {}", scratch);
        } catch (IOException e) {
            log.warn("Cannot remove scratch directory {}: {}", scratch, e.getMessage());
        }
    }
}
