package com.codescan.core.rules.importer;

/**
 * Raised when a remote rule set cannot be fetched or is malformed.
 *
 * <p>Covers HTTP failures, unexpected status codes, clone failures and payloads of the
 * wrong shape. Rule store operations translate it into a failed result and leave the store
 * untouched.
 */
public class RuleFetchException extends Exception {

    public RuleFetchException(String message) {
        super(message);
    }

    public RuleFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
