package com.codescan.core.rules;

/**
 * Outcome of a rule import.
 *
 * @param success whether the import ran to completion
 * @param added number of rules newly added to the store
 */
public record RuleImportResult(boolean success, int added) {

    public static RuleImportResult failed() {
        return new RuleImportResult(false, 0);
    }

    public static RuleImportResult succeeded(int added) {
        return new RuleImportResult(true, added);
    }
}
