package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a rule in the rule store.
 */
public enum RuleSource {
    /** Hand-authored by an operator. */
    USER,
    /** Translated from the third-party rule dialect. */
    SEMGREP,
    /** Shipped with the default rule set. */
    BUILTIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleSource fromValue(String value) {
        if (value == null) {
            return USER;
        }
        for (RuleSource source : values()) {
            if (source.value().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        return USER;
    }
}
