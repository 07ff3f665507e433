package com.codescan.core.rules;

import com.codescan.core.model.RulePattern;

import java.util.List;

/**
 * Read-only view of the active rules.
 */
@FunctionalInterface
public interface RuleSet {

    /**
     * Returns the rules that apply to a language: the {@code common} bucket followed by
     * the language's own bucket.
     *
     * @param language language name, any case
     * @return new list of applicable rules
     */
    List<RulePattern> getPatternsFor(String language);
}
