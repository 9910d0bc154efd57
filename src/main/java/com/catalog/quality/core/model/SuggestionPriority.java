package com.catalog.quality.core.model;

public enum SuggestionPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    SuggestionPriority(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps a violation severity onto the priority of the suggestion derived from it.
     */
    public static SuggestionPriority fromSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> CRITICAL;
            case ERROR -> HIGH;
            case WARNING -> MEDIUM;
            case INFO -> LOW;
        };
    }

    public static SuggestionPriority fromWireName(String value) {
        for (SuggestionPriority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown suggestion priority: " + value);
    }
}
