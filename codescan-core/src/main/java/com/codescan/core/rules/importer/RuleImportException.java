package com.codescan.core.rules.importer;

/**
 * Raised when a single dialect rule cannot be translated.
 *
 * <p>The importer catches it per rule, logs it and drops the rule.
 */
public class RuleImportException extends RuntimeException {

    public RuleImportException(String message) {
        super(message);
    }

    public RuleImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
