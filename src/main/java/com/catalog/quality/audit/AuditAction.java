package com.catalog.quality.audit;

/**
 * Auditable state transitions.
 */
public enum AuditAction {
    SESSION_STARTED,
    SESSION_STOP_REQUESTED,
    SESSION_COMPLETED,
    SESSION_STOPPED,
    SESSION_FAILED,
    GROUP_MERGED,
    VIOLATION_RESOLVED,
    SUGGESTION_APPLIED,
    CACHE_INVALIDATED
}
