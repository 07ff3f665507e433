package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one scan invocation.
 *
 * <p>Created once per scan, fully populated before it is handed to report generators,
 * and never mutated afterwards. {@link #totalIssues()} and {@link #issuesBySeverity()} are
 * derived from {@code findings} and are not serialized.
 *
 * @param scanId scan identifier
 * @param scanPath scanned file or directory
 * @param scanType kind of scan
 * @param timestamp scan start, epoch milliseconds
 * @param findings findings in aggregation order
 * @param stats scan statistics
 * @param projectInfo free-form project description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanResult(
    @JsonProperty("scan_id") String scanId,
    @JsonProperty("scan_path") String scanPath,
    @JsonProperty("scan_type") ScanType scanType,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("findings") List<VulnerabilityIssue> findings,
    @JsonProperty("stats") ScanStats stats,
    @JsonProperty("project_info") Map<String, Object> projectInfo
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(scanId, "scanId must not be null");
        Objects.requireNonNull(scanPath, "scanPath must not be null");
        Objects.requireNonNull(scanType, "scanType must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (stats == null) {
            stats = ScanStats.empty();
        }
        projectInfo = projectInfo == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(projectInfo));
    }

    /**
     * Returns the number of findings.
     *
     * @return finding count
     */
    public int totalIssues() {
        return findings.size();
    }

    /**
     * Counts findings per severity. Every severity is present, with zero when unused.
     *
     * @return severity to count, in severity order
     */
    public Map<Severity, Integer> issuesBySeverity() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        for (VulnerabilityIssue issue : findings) {
            counts.merge(issue.severity(), 1, Integer::sum);
        }
        return counts;
    }
}
