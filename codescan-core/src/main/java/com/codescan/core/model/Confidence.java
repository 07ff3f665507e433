package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence attached to a finding.
 *
 * <p><b>Levels:</b></p>
 * <ul>
 *   <li><b>HIGH:</b> diagnostics produced by the scanner itself (provider failures)</li>
 *   <li><b>MEDIUM:</b> rule matches, and the default for provider findings</li>
 *   <li><b>LOW:</b> unparseable provider output</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a confidence leniently.
     *
     * @param value wire value, any case, may be null
     * @return matching confidence, or {@link #MEDIUM} when unknown
     */
    @JsonCreator
    public static Confidence fromValue(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (Confidence confidence : values()) {
            if (confidence.value().equalsIgnoreCase(value.trim())) {
                return confidence;
            }
        }
        return MEDIUM;
    }
}
