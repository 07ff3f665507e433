package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single reported issue, always attributed to exactly one file.
 *
 * @param severity severity of the issue
 * @param filePath file the issue belongs to
 * @param lineNumber 1-based line, or null when it could not be located
 * @param codeSnippet code around the issue, or null
 * @param description what was found
 * @param recommendation how to fix it, may be empty
 * @param cweId CWE classification, or null
 * @param confidence how reliable the finding is
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VulnerabilityIssue(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("line_number") Integer lineNumber,
    @JsonProperty("code_snippet") String codeSnippet,
    @JsonProperty("description") String description,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("cwe_id") String cweId,
    @JsonProperty("confidence") Confidence confidence
) {
    /**
     * Compact constructor with validation.
     */
    public VulnerabilityIssue {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
        if (description == null) {
            description = "";
        }
        if (recommendation == null) {
            recommendation = "";
        }
        if (confidence == null) {
            confidence = Confidence.MEDIUM;
        }
    }

    /**
     * Creates an issue without location information.
     *
     * @param severity severity
     * @param filePath file path
     * @param description description
     * @param recommendation recommendation
     * @param confidence confidence
     * @return unlocated issue
     */
    public static VulnerabilityIssue unlocated(
            Severity severity,
            String filePath,
            String description,
            String recommendation,
            Confidence confidence) {
        return new VulnerabilityIssue(severity, filePath, null, null, description, recommendation, null, confidence);
    }

    /**
     * Returns true if a line number is known.
     *
     * @return true when located
     */
    @JsonIgnore
    public boolean isLocated() {
        return lineNumber != null;
    }
}
