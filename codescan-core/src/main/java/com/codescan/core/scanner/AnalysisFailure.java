package com.codescan.core.scanner;

import com.codescan.core.provider.ProviderException;

import java.util.Objects;

/**
 * Why a provider-backed file analysis produced no findings.
 *
 * @param kind failure category
 * @param message failure detail
 */
public record AnalysisFailure(Kind kind, String message) {

    /**
     * Failure category: the provider kinds plus unparseable output.
     */
    public enum Kind {
        AUTH("Authentication"),
        TIMEOUT("Timeout"),
        CONNECTION("Connection"),
        OTHER("Provider"),
        PARSE("Parse");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public AnalysisFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    /**
     * Converts a provider exception.
     *
     * @param e provider failure
     * @return failure of the matching kind
     */
    public static AnalysisFailure from(ProviderException e) {
        Kind kind = switch (e.kind()) {
            case AUTH -> Kind.AUTH;
            case TIMEOUT -> Kind.TIMEOUT;
            case CONNECTION -> Kind.CONNECTION;
            case OTHER -> Kind.OTHER;
        };
        return new AnalysisFailure(kind, e.getMessage());
    }

    public static AnalysisFailure parse(String message) {
        return new AnalysisFailure(Kind.PARSE, message);
    }
}
