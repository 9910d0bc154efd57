package com.catalog.quality.core.model;

/**
 * Lifecycle status of a normalization session.
 * {@link #RUNNING} is the only non-terminal status.
 */
public enum SessionStatus {
    RUNNING("running"),
    STOPPED("stopped"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static SessionStatus fromWireName(String value) {
        for (SessionStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
