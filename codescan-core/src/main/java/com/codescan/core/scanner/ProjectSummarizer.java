package com.codescan.core.scanner;

import com.codescan.core.model.ScanStats;
import com.codescan.core.provider.AnalysisAdapter;
import com.codescan.core.provider.ProviderException;
import com.codescan.core.util.FileUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the analysis provider for a short description of a scanned project.
 *
 * <p>The prompt carries the scan statistics and the directory tree down to three levels.
 * The answer is expected as a JSON object with {@code project_type},
 * {@code main_functionality}, {@code components}, {@code architecture} and
 * {@code use_cases}; missing fields are filled with placeholders. When the provider fails
 * or answers with something else, the raw text is kept under {@code analysis_text}.
 * Every summary also carries {@code main_language} and {@code stats}.
 */
public class ProjectSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ProjectSummarizer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() { };
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);

    static final int TREE_DEPTH = 3;
    static final String NOT_ANALYZED = "Not analyzed";
    private static final List<String> TEXT_FIELDS = List.of("project_type", "main_functionality", "architecture");
    private static final List<String> LIST_FIELDS = List.of("components", "use_cases");

    private final AnalysisAdapter adapter;
    private final PathFilter filter;

    public ProjectSummarizer(AnalysisAdapter adapter, PathFilter filter) {
        this.adapter = adapter;
        this.filter = filter;
    }

    /**
     * Summarizes a project. Never throws.
     *
     * @param directory project directory
     * @param stats scan statistics
     * @return project information
     */
    public Map<String, Object> summarize(Path directory, ScanStats stats) {
        Map<String, Object> statistics = statistics(stats);
        String mainLanguage = mainLanguage(stats);

        String response;
        try {
            String prompt = AnalysisPrompts.forProject(
                directory,
                MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(statistics),
                mainLanguage,
                MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(directoryTree(directory, TREE_DEPTH)));
            response = adapter.analyze(prompt);
        } catch (ProviderException e) {
            log.warn("Project summary failed: {} {}", e.kind(), e.getMessage());
            return fallback(statistics, mainLanguage, "");
        } catch (JsonProcessingException e) {
            log.warn("Cannot render project summary prompt: {}", e.getMessage());
            return fallback(statistics, mainLanguage, "");
        }

        Map<String, Object> summary = parseObject(response);
        if (summary == null) {
            log.warn("Project summary is not a JSON object, keeping raw text");
            return fallback(statistics, mainLanguage, response.replace("```json", "").replace("```", "").trim());
        }
        for (String field : TEXT_FIELDS) {
            summary.putIfAbsent(field, NOT_ANALYZED);
        }
        for (String field : LIST_FIELDS) {
            summary.putIfAbsent(field, List.of());
        }
        summary.put("main_language", mainLanguage);
        summary.put("stats", statistics);
        return summary;
    }

    /**
     * Basic project information used when no summary is requested.
     *
     * @param stats scan statistics
     * @return main language and statistics
     */
    public static Map<String, Object> basicInfo(ScanStats stats) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("main_language", mainLanguage(stats));
        info.put("stats", statistics(stats));
        return info;
    }

    /**
     * Builds a nested map of the directory tree. Directories map to their children, files
     * to {@code {"type": "file", "size": <bytes>}}; excluded paths are left out and levels
     * below {@code depth} are elided as {@code {"...": "..."}}.
     *
     * @param directory directory to describe
     * @param depth levels to descend
     * @return tree
     */
    Map<String, Object> directoryTree(Path directory, int depth) {
        Map<String, Object> tree = new LinkedHashMap<>();
        if (depth <= 0) {
            tree.put("...", "...");
            return tree;
        }
        try {
            for (Path child : FileUtils.listSorted(directory)) {
                if (filter.shouldExclude(child)) {
                    continue;
                }
                String name = child.getFileName().toString();
                if (Files.isDirectory(child)) {
                    tree.put(name, directoryTree(child, depth - 1));
                } else {
                    tree.put(name, Map.of("type", "file", "size", Files.size(child)));
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", directory, e.getMessage());
        }
        return tree;
    }

    private static Map<String, Object> parseObject(String response) {
        if (response == null || response.isBlank()) {
            return null;
        }
        Map<String, Object> direct = readObject(response.trim());
        if (direct != null) {
            return direct;
        }
        Matcher fence = FENCE.matcher(response);
        if (fence.find()) {
            Map<String, Object> fenced = readObject(fence.group(1));
            if (fenced != null) {
                return fenced;
            }
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return readObject(response.substring(start, end + 1));
        }
        return null;
    }

    private static Map<String, Object> readObject(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            if (node == null || !node.isObject()) {
                return null;
            }
            return MAPPER.convertValue(node, OBJECT);
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static Map<String, Object> fallback(Map<String, Object> statistics, String mainLanguage, String text) {
        Map<String, Object> info = new LinkedHashMap<>();
        for (String field : TEXT_FIELDS) {
            info.put(field, NOT_ANALYZED);
        }
        for (String field : LIST_FIELDS) {
            info.put(field, List.of());
        }
        info.put("main_language", mainLanguage);
        info.put("stats", statistics);
        info.put("analysis_text", text);
        return info;
    }

    private static Map<String, Object> statistics(ScanStats stats) {
        return MAPPER.convertValue(stats, OBJECT);
    }

    private static String mainLanguage(ScanStats stats) {
        return stats.languages().entrySet().stream()
            .max(Map.Entry.<String, Integer>comparingByValue()
                .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
            .map(Map.Entry::getKey)
            .orElse("unknown");
    }
}
