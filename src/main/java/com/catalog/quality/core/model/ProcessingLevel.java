package com.catalog.quality.core.model;

/**
 * Pipeline maturity of a normalized record.
 */
public enum ProcessingLevel {
    BASIC("basic"),
    AI_ENHANCED("ai_enhanced"),
    BENCHMARK("benchmark");

    private final String wireName;

    ProcessingLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ProcessingLevel fromWireName(String value) {
        for (ProcessingLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown processing level: " + value);
    }
}
