package com.catalog.quality.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable transition.
 *
 * @param subject the affected object, e.g. {@code group:42} or a database path
 * @param actor   who triggered it, {@code system} for engine-driven transitions
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subject,
        String actor,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        id = id != null ? id : UUID.randomUUID().toString();
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
