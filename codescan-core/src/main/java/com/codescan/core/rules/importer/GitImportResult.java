package com.codescan.core.rules.importer;

import com.codescan.core.model.RulePattern;

import java.util.List;
import java.util.Map;

/**
 * Rules translated from a git repository.
 *
 * @param rules translated rules per bucket
 * @param count total number of bucket entries
 */
public record GitImportResult(
    Map<String, List<RulePattern>> rules,
    int count
) {
    public GitImportResult {
        rules = rules == null ? Map.of() : Map.copyOf(rules);
    }
}
