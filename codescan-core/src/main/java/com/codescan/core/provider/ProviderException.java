package com.codescan.core.provider;

import java.util.Objects;

/**
 * Raised when an analysis provider call fails.
 *
 * <p>The {@link Kind} lets callers report the failure category without inspecting
 * messages or causes.
 */
public class ProviderException extends Exception {

    /**
     * Failure category of a provider call.
     */
    public enum Kind {
        /** Missing, invalid or rejected credentials. */
        AUTH,
        /** The request did not complete within its timeout. */
        TIMEOUT,
        /** The provider could not be reached. */
        CONNECTION,
        /** Any other failure, including unexpected status codes and unreadable payloads. */
        OTHER
    }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public Kind kind() {
        return kind;
    }
}
