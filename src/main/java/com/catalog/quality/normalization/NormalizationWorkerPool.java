package com.catalog.quality.normalization;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.NormalizationSession;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.RawCatalogItem;
import com.catalog.quality.core.model.SessionStatus;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.logging.LogContext;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.session.SessionStore;
import com.catalog.quality.store.CatalogDatabase;
import com.catalog.quality.store.CatalogDatabaseProvider;
import com.catalog.quality.store.RawItemCursor;
import com.catalog.quality.tracing.Span;
import com.catalog.quality.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs normalization sessions, one worker task per database, at most
 * {@link WorkerPoolConfig#concurrency()} at a time. Further sessions wait in the queue.
 *
 * <p>A worker streams raw items in batches, writes each normalized record, and updates its
 * session after every batch. Stop requests and the session deadline are checked only between
 * batches, so a batch is always written completely. Each batch holds the database lock that
 * merge and apply also take, and analysis checks for a stop between its steps. A session whose heartbeat goes stale, for
 * example because its process died, is failed by the reaper.</p>
 */
public class NormalizationWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NormalizationWorkerPool.class);

    static final String STALE_ERROR = "stale session: no heartbeat";
    static final String TIMEOUT_ERROR = "session timeout exceeded";

    public static final String STEP_QUEUED = "queued";
    public static final String STEP_NORMALIZING = "normalizing";
    public static final String STEP_DONE = "done";

    private final WorkerPoolConfig config;
    private final SessionStore sessions;
    private final CatalogDatabaseProvider databases;
    private final CatalogNormalizer normalizer;
    private final DatabaseAnalyzer analyzer;
    private final EntityLock locks;
    private final List<DatabaseChangeListener> listeners;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final AuditService audit;
    private final Clock clock;

    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService reaper;
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Set<String> queued = ConcurrentHashMap.newKeySet();

    public NormalizationWorkerPool(WorkerPoolConfig config,
                                   SessionStore sessions,
                                   CatalogDatabaseProvider databases,
                                   CatalogNormalizer normalizer,
                                   DatabaseAnalyzer analyzer,
                                   EntityLock locks,
                                   List<DatabaseChangeListener> listeners,
                                   MetricsService metrics,
                                   TracingService tracing,
                                   AuditService audit,
                                   Clock clock) {
        this.config = config;
        this.sessions = sessions;
        this.databases = databases;
        this.normalizer = normalizer;
        this.analyzer = analyzer;
        this.locks = locks;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.tracing = tracing;
        this.audit = audit;
        this.clock = clock;
        this.workers = new ThreadPoolExecutor(config.concurrency(), config.concurrency(),
                0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threads("normalization-worker"));
        this.reaper = Executors.newSingleThreadScheduledExecutor(threads("normalization-reaper"));
        this.reaper.scheduleWithFixedDelay(this::reapSafely,
                config.reaperIntervalSeconds(), config.reaperIntervalSeconds(), TimeUnit.SECONDS);
    }

    /**
     * Creates one running session per target and queues its worker. Either every target gets
     * a session or, when any of them already has a running one, none does.
     *
     * @throws com.catalog.quality.error.ConflictException listing the busy databases
     */
    public List<NormalizationSession> start(List<TargetDatabase> targets) {
        reapStale();
        Instant now = clock.instant();
        List<NormalizationSession> created = new ArrayList<>();
        for (TargetDatabase target : targets) {
            created.add(NormalizationSession.start(UUID.randomUUID().toString(), target.filePath(),
                    config.sessionTimeoutSeconds(), now).withStep(STEP_QUEUED, now));
        }
        sessions.createAll(created);

        for (int i = 0; i < created.size(); i++) {
            NormalizationSession session = created.get(i);
            TargetDatabase target = targets.get(i);
            CancellationToken token = new CancellationToken();
            tokens.put(session.id(), token);
            queued.add(session.id());
            audit.record(AuditAction.SESSION_STARTED, session.databaseKey(), AuditService.SYSTEM_ACTOR,
                    Map.of("sessionId", session.id()));
            log.info("normalization.session.started sessionId={} database={}", session.id(), session.databaseKey());
            workers.execute(() -> run(session.id(), target, token));
        }
        return List.copyOf(created);
    }

    /**
     * Signals every running session whose database matches. Sessions without a live worker,
     * such as those restored after a restart, are stopped directly.
     */
    public StopResult stop(Predicate<String> databaseMatcher) {
        List<String> signalled = new ArrayList<>();
        for (NormalizationSession session : sessions.running()) {
            if (!databaseMatcher.test(session.databaseKey())) {
                continue;
            }
            signalled.add(session.id());
            audit.record(AuditAction.SESSION_STOP_REQUESTED, session.databaseKey());
            CancellationToken token = tokens.get(session.id());
            if (token != null) {
                token.cancel();
                log.info("normalization.stop.requested sessionId={} database={}", session.id(), session.databaseKey());
            } else {
                finish(session.id(), SessionStatus.STOPPED, null);
            }
        }
        return new StopResult(!signalled.isEmpty(), signalled);
    }

    public boolean isActive(String sessionId) {
        return tokens.containsKey(sessionId);
    }

    /**
     * Fails running sessions whose heartbeat is stale or whose deadline passed. Queued sessions
     * of this pool are exempt from the heartbeat check.
     *
     * @return number of sessions failed
     */
    public int reapStale() {
        Instant now = clock.instant();
        Duration staleness = Duration.ofSeconds(config.heartbeatStalenessSeconds());
        int reaped = 0;
        for (NormalizationSession session : sessions.running()) {
            boolean timedOut = session.startedAt().plusSeconds(session.timeoutSeconds()).isBefore(now);
            boolean waiting = queued.contains(session.id());
            if (!timedOut && (waiting || !session.isStale(now, staleness))) {
                continue;
            }
            CancellationToken token = tokens.get(session.id());
            if (token != null) {
                token.cancel();
            }
            if (finish(session.id(), SessionStatus.FAILED, timedOut ? TIMEOUT_ERROR : STALE_ERROR)) {
                log.warn("normalization.session.reaped sessionId={} database={} reason={}",
                        session.id(), session.databaseKey(), timedOut ? "timeout" : "stale");
                reaped++;
            }
        }
        return reaped;
    }

    private void run(String sessionId, TargetDatabase target, CancellationToken token) {
        queued.remove(sessionId);
        try (LogContext ignored = LogContext.forSession(sessionId, target.filePath());
             Span span = tracing.startSpan("normalization.run", Map.of("database", target.filePath()))) {
            try {
                SessionStatus outcome = normalize(sessionId, target, token);
                finish(sessionId, outcome, null);
                span.setStatus(Span.SpanStatus.OK);
            } catch (RuntimeException e) {
                log.error("normalization.session.failed sessionId={} database={} error={}",
                        sessionId, target.filePath(), e.getMessage(), e);
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                finish(sessionId, SessionStatus.FAILED, e.getMessage() != null ? e.getMessage() : e.toString());
            }
        } finally {
            tokens.remove(sessionId);
        }
    }

    private SessionStatus normalize(String sessionId, TargetDatabase target, CancellationToken token) {
        if (token.isCancelled()) {
            return SessionStatus.STOPPED;
        }
        CatalogDatabase database = databases.open(target);
        long processed = 0;
        long failed = 0;
        try (RawItemCursor cursor = database.openRawItems()) {
            long total = cursor.total();
            sessions.update(sessionId, s -> s.isRunning()
                    ? s.withTotal(total).withStep(STEP_NORMALIZING, clock.instant()) : s);
            while (true) {
                if (token.isCancelled() || !stillRunning(sessionId)) {
                    log.info("normalization.session.stopping sessionId={} processed={}", sessionId, processed);
                    return SessionStatus.STOPPED;
                }
                List<RawCatalogItem> batch = cursor.nextBatch(config.batchSize());
                if (batch.isEmpty()) {
                    break;
                }
                int batchFailures = writeBatch(database, batch);
                processed += batch.size();
                failed += batchFailures;
                metrics.recordBatchSize(batch.size());
                metrics.recordItemsNormalized(batch.size() - batchFailures);
                if (batchFailures > 0) {
                    metrics.recordItemsFailed(batchFailures);
                }
                long p = processed;
                long f = failed;
                sessions.update(sessionId, s -> s.isRunning() ? s.withProgress(p, f, clock.instant()) : s);
                log.debug("normalization.batch.completed sessionId={} processed={} failed={}", sessionId, p, f);
            }
        }

        if (config.analyzeAfterNormalization() && analyzer != null && !token.isCancelled()) {
            AnalysisSummary summary = analyzer.analyze(database,
                    step -> sessions.update(sessionId, s -> s.isRunning() ? s.withStep(step, clock.instant()) : s),
                    () -> token.isCancelled() || !stillRunning(sessionId));
            sessions.update(sessionId, s -> s.withAnalysis(
                    summary.duplicatesFound(), summary.violationsFound(), summary.suggestionsFound()));
        }
        notifyChanged(target.filePath());
        if (token.isCancelled() || !stillRunning(sessionId)) {
            log.info("normalization.session.stopping sessionId={} processed={} during=analysis", sessionId, processed);
            return SessionStatus.STOPPED;
        }
        log.info("normalization.session.completed sessionId={} processed={} failed={}", sessionId, processed, failed);
        return SessionStatus.COMPLETED;
    }

    private int writeBatch(CatalogDatabase database, List<RawCatalogItem> batch) {
        return locks.withLock(EntityLock.databaseKey(database.key()), () -> {
            int failures = 0;
            for (RawCatalogItem item : batch) {
                try {
                    NormalizedRecord record = normalizer.normalize(item, database.key());
                    database.upsert(record);
                } catch (RuntimeException e) {
                    failures++;
                    log.warn("normalization.item.failed reference={} error={}", item.reference(), e.getMessage());
                }
            }
            return failures;
        });
    }

    private boolean stillRunning(String sessionId) {
        Instant now = clock.instant();
        return sessions.find(sessionId)
                .map(s -> s.isRunning() && !s.startedAt().plusSeconds(s.timeoutSeconds()).isBefore(now))
                .orElse(false);
    }

    /**
     * Moves a running session to a terminal status. A session that already ended is left alone.
     *
     * @return whether this call ended the session
     */
    private boolean finish(String sessionId, SessionStatus status, String error) {
        boolean[] ended = {false};
        NormalizationSession result = sessions.update(sessionId, s -> {
            if (!s.isRunning()) {
                return s;
            }
            ended[0] = true;
            NormalizationSession done = s.finish(status, error, clock.instant());
            return status == SessionStatus.COMPLETED ? done.withStep(STEP_DONE, done.endedAt()) : done;
        });
        if (ended[0]) {
            metrics.recordSessionEnded(status);
            audit.record(auditAction(status), result.databaseKey(), AuditService.SYSTEM_ACTOR,
                    error != null ? Map.of("sessionId", sessionId, "error", error) : Map.of("sessionId", sessionId));
        }
        return ended[0];
    }

    private void notifyChanged(String databaseKey) {
        for (DatabaseChangeListener listener : listeners) {
            try {
                listener.onDatabaseChanged(databaseKey);
            } catch (RuntimeException e) {
                log.warn("normalization.listener.failed database={} error={}", databaseKey, e.getMessage());
            }
        }
    }

    private void reapSafely() {
        try {
            reapStale();
        } catch (RuntimeException e) {
            log.error("normalization.reaper.failed error={}", e.getMessage(), e);
        }
    }

    private static AuditAction auditAction(SessionStatus status) {
        return switch (status) {
            case COMPLETED -> AuditAction.SESSION_COMPLETED;
            case STOPPED -> AuditAction.SESSION_STOPPED;
            default -> AuditAction.SESSION_FAILED;
        };
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        tokens.values().forEach(CancellationToken::cancel);
        reaper.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
