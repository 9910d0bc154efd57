package com.catalog.quality.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail of session, merge, resolve and apply transitions.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = clock;
    }

    public AuditEntry record(AuditAction action, String subject, String actor, Map<String, Object> details) {
        AuditEntry entry = new AuditEntry(null, action, subject, actor, details, clock.instant());
        entries.add(entry);
        log.debug("audit.recorded action={} subject={} actor={}", action, subject, actor);
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject) {
        return record(action, subject, SYSTEM_ACTOR, null);
    }

    public List<AuditEntry> entriesByAction(AuditAction action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }
}
