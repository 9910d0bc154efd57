package com.catalog.quality.duplicate;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.ConflictException.ConflictReason;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.logging.LogContext;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.normalization.DatabaseChangeListener;
import com.catalog.quality.store.CatalogDatabase;
import com.catalog.quality.store.CatalogDatabaseProvider;
import com.catalog.quality.store.QualityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Folds a duplicate group into its master record: other active members are deactivated,
 * the master's merged count grows by their number and the group is marked merged. Any failing
 * step undoes the earlier ones. A group merges once, and never while normalization runs on its database.
 */
public class DuplicateMerger {
    private static final Logger log = LoggerFactory.getLogger(DuplicateMerger.class);

    private final QualityStore store;
    private final CatalogDatabaseProvider databases;
    private final EntityLock locks;
    private final Predicate<String> normalizationRunning;
    private final List<DatabaseChangeListener> listeners;
    private final MetricsService metrics;
    private final AuditService audit;
    private final Clock clock;

    public DuplicateMerger(QualityStore store, CatalogDatabaseProvider databases, EntityLock locks,
                           Predicate<String> normalizationRunning, List<DatabaseChangeListener> listeners, MetricsService metrics,
                           AuditService audit, Clock clock) {
        this.store = store;
        this.databases = databases;
        this.locks = locks;
        this.normalizationRunning = normalizationRunning;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * @throws NotFoundException  if the group is unknown
     * @throws ConflictException  if the group is already merged, its master is no longer active or
     *                            normalization is running on its database
     */
    public MergeResult merge(long groupId) {
        DuplicateGroup known = store.findGroup(groupId)
                .orElseThrow(() -> NotFoundException.of("Duplicate group", groupId));
        try (LogContext ignored = LogContext.forMerge(groupId, known.getDatabaseKey())) {
            MergeResult result = locks.withLock(EntityLock.groupKey(groupId), () -> mergeLocked(groupId));
            metrics.incrementGroupsMerged();
            audit.record(AuditAction.GROUP_MERGED, "group:" + groupId, AuditService.SYSTEM_ACTOR,
                    Map.of("masterId", result.masterId(), "deactivated", result.deactivatedIds()));
            listeners.forEach(listener -> listener.onDatabaseChanged(result.databaseKey()));
            log.info("duplicates.merge.completed groupId={} masterId={} deactivated={}",
                    groupId, result.masterId(), result.deactivatedIds().size());
            return result;
        }
    }

    private MergeResult mergeLocked(long groupId) {
        DuplicateGroup group = store.findGroup(groupId)
                .orElseThrow(() -> NotFoundException.of("Duplicate group", groupId));
        if (group.isMerged()) {
            throw new ConflictException(ConflictReason.ALREADY_MERGED, "Duplicate group already merged: " + groupId);
        }
        CatalogDatabase database = databases.open(TargetDatabase.ofPath(group.getDatabaseKey()));
        return locks.withLock(EntityLock.databaseKey(database.key()), () -> {
            if (normalizationRunning.test(database.key())) {
                throw new ConflictException(ConflictReason.ALREADY_RUNNING,
                        "Normalization is running for " + database.key(), List.of(database.key()));
            }
            return foldMembers(group, database);
        });
    }

    private MergeResult foldMembers(DuplicateGroup group, CatalogDatabase database) {
        long masterId = group.getSuggestedMasterId();
        NormalizedRecord master = database.findById(masterId)
                .orElseThrow(() -> NotFoundException.of("Record", database.key() + "#" + masterId));
        if (!master.isActive()) {
            throw new ConflictException(ConflictReason.ALREADY_MERGED,
                    "Master record " + masterId + " was already merged away");
        }
        Instant now = clock.instant();
        List<Long> deactivated = new ArrayList<>();
        List<NormalizedRecord> changes = new ArrayList<>();
        for (Long memberId : group.getMemberIds()) {
            if (memberId == masterId) {
                continue;
            }
            NormalizedRecord member = database.findById(memberId).orElse(null);
            if (member == null || !member.isActive()) {
                log.debug("duplicates.merge.member.skipped recordId={}", memberId);
                continue;
            }
            changes.add(member.toBuilder().active(false).updatedAt(now).build());
            deactivated.add(memberId);
        }
        changes.add(master.toBuilder()
                .mergedCount(master.getMergedCount() + deactivated.size())
                .updatedAt(now)
                .build());
        database.updateAll(changes, () -> store.updateGroup(group.markMerged(now)));
        return new MergeResult(group.getId(), database.key(), masterId, deactivated, now);
    }
}
