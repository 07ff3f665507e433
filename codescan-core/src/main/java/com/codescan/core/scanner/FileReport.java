package com.codescan.core.scanner;

import com.codescan.core.model.VulnerabilityIssue;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Analysis result of one file, as aggregated by the orchestrator.
 *
 * @param path analysed file
 * @param language language of the file
 * @param linesOfCode number of lines
 * @param findings findings for the file
 */
public record FileReport(
    Path path,
    String language,
    int linesOfCode,
    List<VulnerabilityIssue> findings
) {
    public FileReport {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
