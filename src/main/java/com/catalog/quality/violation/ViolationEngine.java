package com.catalog.quality.violation;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.store.QualityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates records against the rule catalogue and resolves violations.
 */
public class ViolationEngine {
    private static final Logger log = LoggerFactory.getLogger(ViolationEngine.class);

    private final List<ViolationRule> rules;
    private final QualityStore store;
    private final EntityLock locks;
    private final MetricsService metrics;
    private final AuditService audit;
    private final Clock clock;

    public ViolationEngine(List<ViolationRule> rules, QualityStore store, EntityLock locks,
                           MetricsService metrics, AuditService audit, Clock clock) {
        this.rules = List.copyOf(rules);
        this.store = store;
        this.locks = locks;
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Inserts a violation for every (record, broken rule) pair that has no unresolved violation
     * yet. Resolved violations are neither touched nor recreated.
     *
     * @return violations created by this call
     */
    public List<Violation> detect(String databaseKey, Collection<NormalizedRecord> records) {
        Set<String> open = new HashSet<>();
        Set<String> resolved = new HashSet<>();
        for (Violation v : store.violations(v -> databaseKey.equals(v.getDatabaseKey()))) {
            (v.isResolved() ? resolved : open).add(pairKey(v.getNormalizedItemId(), v.getRuleName()));
        }

        List<Violation> created = new ArrayList<>();
        for (NormalizedRecord record : records) {
            if (!record.isActive()) {
                continue;
            }
            for (ViolationRule rule : rules) {
                String key = pairKey(record.getId(), rule.getName());
                if (open.contains(key) || resolved.contains(key) || !rule.isViolatedBy(record)) {
                    continue;
                }
                String value = ViolationRules.valueOf(record, rule.getField());
                Violation violation = store.insertViolation(Violation.builder()
                        .databaseKey(databaseKey)
                        .normalizedItemId(record.getId())
                        .ruleName(rule.getName())
                        .category(rule.getCategory())
                        .severity(rule.getSeverity())
                        .fieldName(rule.getField())
                        .currentValue(value)
                        .message(rule.message(value))
                        .recommendation(rule.recommendation(value))
                        .createdAt(clock.instant())
                        .build());
                open.add(key);
                created.add(violation);
            }
        }
        metrics.recordViolationsDetected(created.size());
        log.info("violations.detection.completed database={} records={} created={}",
                databaseKey, records.size(), created.size());
        return created;
    }

    /**
     * Marks a violation resolved. Repeating the call succeeds and keeps the first resolver.
     *
     * @throws NotFoundException   for an unknown id
     * @throws ValidationException for a blank resolver
     */
    public Violation resolve(long violationId, String resolvedBy) {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new ValidationException("resolved_by is required");
        }
        return locks.withLock(EntityLock.violationKey(violationId), () -> {
            Violation current = store.findViolation(violationId)
                    .orElseThrow(() -> NotFoundException.of("Violation", violationId));
            if (current.isResolved()) {
                log.debug("violations.resolve.repeated violationId={} resolvedBy={}", violationId, current.getResolvedBy());
                return current;
            }
            Violation resolved = store.updateViolation(current.resolve(resolvedBy, clock.instant()));
            metrics.incrementViolationsResolved();
            audit.record(AuditAction.VIOLATION_RESOLVED, "violation:" + violationId, resolvedBy,
                    Map.of("rule", resolved.getRuleName()));
            log.info("violations.resolved violationId={} resolvedBy={}", violationId, resolvedBy);
            return resolved;
        });
    }

    public List<ViolationRule> rules() {
        return rules;
    }

    private static String pairKey(long recordId, String ruleName) {
        return recordId + "|" + ruleName;
    }
}
