package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a finding or of the rule that produced it.
 *
 * <p>Serialized in lower case ({@code "critical"}, {@code "high"}, ...). Unknown or
 * missing values read from provider output or rule documents fall back to {@link #MEDIUM}.
 *
 * @since 1.0.0
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Returns the wire value of this severity.
     *
     * @return lower-case name
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity leniently.
     *
     * @param value wire value, any case, may be null
     * @return matching severity, or {@link #MEDIUM} when unknown
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (Severity severity : values()) {
            if (severity.value().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return MEDIUM;
    }
}
