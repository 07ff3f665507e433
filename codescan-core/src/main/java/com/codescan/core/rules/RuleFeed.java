package com.codescan.core.rules;

import com.codescan.core.model.RulePattern;
import com.codescan.core.rules.importer.RuleFetchException;

import java.util.List;
import java.util.Map;

/**
 * Source of complete rule sets for wholesale updates.
 */
@FunctionalInterface
public interface RuleFeed {

    /**
     * Fetches the latest rule set.
     *
     * @param url feed URL
     * @return rules per bucket
     * @throws RuleFetchException if the feed is unreachable or not a mapping of buckets
     */
    Map<String, List<RulePattern>> fetch(String url) throws RuleFetchException;
}
