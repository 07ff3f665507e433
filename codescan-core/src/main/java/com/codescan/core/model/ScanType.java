package com.codescan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of scan that produced a {@link ScanResult}.
 */
public enum ScanType {
    FILE("file"),
    DIRECTORY("directory"),
    GIT_MERGE("git-merge");

    private final String value;

    ScanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScanType fromValue(String value) {
        for (ScanType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scan type: " + value);
    }
}
