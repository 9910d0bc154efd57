package com.catalog.quality.core.model;

/**
 * Severity of a quality rule violation, ordered from least to most severe.
 */
public enum Severity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Severity fromWireName(String value) {
        for (Severity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
