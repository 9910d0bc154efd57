package com.catalog.quality.core.model;

/**
 * Kind of correction a suggestion proposes.
 * Only {@link #SET_VALUE} and {@link #CORRECT_FORMAT} write a field when applied.
 */
public enum SuggestionType {
    SET_VALUE("set_value"),
    CORRECT_FORMAT("correct_format"),
    REPROCESS("reprocess"),
    MERGE("merge"),
    REVIEW("review");

    private final String wireName;

    SuggestionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean writesField() {
        return this == SET_VALUE || this == CORRECT_FORMAT;
    }

    public static SuggestionType fromWireName(String value) {
        for (SuggestionType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown suggestion type: " + value);
    }
}
