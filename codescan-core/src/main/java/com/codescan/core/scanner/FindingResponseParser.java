package com.codescan.core.scanner;

import com.codescan.core.model.Confidence;
import com.codescan.core.model.Severity;
import com.codescan.core.model.VulnerabilityIssue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts findings from free-form provider output.
 *
 * <p>The JSON candidate is taken from, in order:
 * <ol>
 *   <li>the first fenced code block whose body is a JSON array; fences quoting source code
 *       ({@code ```python} and the like) are passed over</li>
 *   <li>the text between the first {@code [} and the last {@code ]}</li>
 *   <li>the whole text</li>
 * </ol>
 * The candidate must be a JSON array. Elements that are not objects are skipped; missing
 * fields fall back to severity and confidence {@code medium}, description
 * {@value #NO_DESCRIPTION} and an empty recommendation.
 */
public class FindingResponseParser {

    static final String NO_DESCRIPTION = "No description provided";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("```[\\w+-]*[ \\t]*\\R?([\\s\\S]*?)\\s*```");

    /**
     * Parses provider output.
     *
     * @param response raw completion text
     * @param filePath path attributed to every finding
     * @return findings, or a {@link AnalysisFailure.Kind#PARSE} failure
     */
    public AnalysisOutcome parse(String response, String filePath) {
        if (response == null || response.isBlank()) {
            return AnalysisOutcome.failed(AnalysisFailure.parse("Empty response"));
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(candidate(response));
        } catch (JsonProcessingException e) {
            return AnalysisOutcome.failed(AnalysisFailure.parse(e.getOriginalMessage()));
        }
        if (root == null || !root.isArray()) {
            return AnalysisOutcome.failed(AnalysisFailure.parse("Response is not a JSON array"));
        }

        List<VulnerabilityIssue> findings = new ArrayList<>();
        for (JsonNode element : root) {
            if (element.isObject()) {
                findings.add(toFinding(element, filePath));
            }
        }
        return AnalysisOutcome.success(findings);
    }

    static String candidate(String response) {
        Matcher fence = FENCE.matcher(response);
        while (fence.find()) {
            String body = fence.group(1).trim();
            if (!body.isEmpty() && isJsonArray(body)) {
                return body;
            }
        }
        String text = response.trim();
        if (!text.startsWith("[")) {
            int start = text.indexOf('[');
            int end = text.lastIndexOf(']');
            if (start >= 0 && end > start) {
                return text.substring(start, end + 1);
            }
        }
        return text;
    }

    private static boolean isJsonArray(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node != null && node.isArray();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static VulnerabilityIssue toFinding(JsonNode node, String filePath) {
        return new VulnerabilityIssue(
            Severity.fromValue(textOrNull(node, "severity")),
            filePath,
            lineNumber(node.get("line_number")),
            textOrNull(node, "code_snippet"),
            node.hasNonNull("description") ? node.get("description").asText() : NO_DESCRIPTION,
            node.hasNonNull("recommendation") ? node.get("recommendation").asText() : "",
            scalarText(node.get("cwe_id")),
            Confidence.fromValue(textOrNull(node, "confidence"))
        );
    }

    private static Integer lineNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt() && node.isNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
