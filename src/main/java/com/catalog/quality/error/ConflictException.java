package com.catalog.quality.error;

import java.util.List;

/**
 * Raised when a consume-once transition is repeated or a run already holds a database.
 */
public class ConflictException extends QualityEngineException {

    public enum ConflictReason {
        ALREADY_RUNNING,
        ALREADY_MERGED,
        ALREADY_APPLIED
    }

    private final ConflictReason reason;
    private final List<String> conflicts;

    public ConflictException(ConflictReason reason, String message) {
        this(reason, message, List.of());
    }

    public ConflictException(ConflictReason reason, String message, List<String> conflicts) {
        super(ErrorKind.CONFLICT, message);
        this.reason = reason;
        this.conflicts = List.copyOf(conflicts);
    }

    public ConflictReason getReason() {
        return reason;
    }

    /**
     * Keys of the conflicting resources, e.g. the database paths that already have a running session.
     */
    public List<String> getConflicts() {
        return conflicts;
    }
}
