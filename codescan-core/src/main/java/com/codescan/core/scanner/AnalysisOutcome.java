package com.codescan.core.scanner;

import com.codescan.core.model.VulnerabilityIssue;

import java.util.List;

/**
 * Result of asking the provider about one file: findings, or the reason there are none.
 *
 * @param findings findings reported by the provider, empty on failure
 * @param failure failure, or null on success
 */
public record AnalysisOutcome(List<VulnerabilityIssue> findings, AnalysisFailure failure) {

    public AnalysisOutcome {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static AnalysisOutcome success(List<VulnerabilityIssue> findings) {
        return new AnalysisOutcome(findings, null);
    }

    public static AnalysisOutcome failed(AnalysisFailure failure) {
        return new AnalysisOutcome(List.of(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
