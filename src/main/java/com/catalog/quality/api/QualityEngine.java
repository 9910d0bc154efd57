package com.catalog.quality.api;

import com.catalog.quality.aggregate.DatabaseStats;
import com.catalog.quality.aggregate.ProjectQualityAggregator;
import com.catalog.quality.aggregate.ProjectStats;
import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.cache.CacheStats;
import com.catalog.quality.cache.QualityStatsCache;
import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizationSession;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.duplicate.DuplicateDetector;
import com.catalog.quality.duplicate.DuplicateMerger;
import com.catalog.quality.duplicate.MergeResult;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.ConflictException.ConflictReason;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.lock.LocalEntityLock;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.metrics.NoOpMetricsService;
import com.catalog.quality.normalization.AnalysisSummary;
import com.catalog.quality.normalization.AttributeExtractor;
import com.catalog.quality.normalization.CatalogNormalizer;
import com.catalog.quality.normalization.CompletenessScorer;
import com.catalog.quality.normalization.DatabaseChangeListener;
import com.catalog.quality.normalization.NameNormalizer;
import com.catalog.quality.normalization.NormalizationWorkerPool;
import com.catalog.quality.normalization.StopResult;
import com.catalog.quality.session.InMemorySessionStore;
import com.catalog.quality.session.JsonFileSessionStore;
import com.catalog.quality.session.SessionStore;
import com.catalog.quality.store.CatalogDatabaseProvider;
import com.catalog.quality.store.FalkorDBCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryQualityStore;
import com.catalog.quality.store.ProjectDatabaseLookup;
import com.catalog.quality.store.QualityStore;
import com.catalog.quality.suggestion.SuggestionApplier;
import com.catalog.quality.suggestion.SuggestionGenerator;
import com.catalog.quality.tracing.NoOpTracingService;
import com.catalog.quality.tracing.TracingService;
import com.catalog.quality.violation.ViolationEngine;
import com.catalog.quality.violation.ViolationRules;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Main entry point of the quality engine: normalization sessions, duplicate groups,
 * violations, suggestions and project statistics.
 *
 * <pre>
 * QualityEngine engine = QualityEngine.builder()
 *     .catalogDatabases(provider)
 *     .projectLookup(lookup)
 *     .build();
 *
 * engine.startNormalization(NormalizationScope.allActive("project-1"));
 * Page&lt;Violation&gt; open = engine.listViolations(ViolationFilter.forDatabase(path), PageRequest.defaults());
 * ProjectStats stats = engine.projectStats("project-1");
 * </pre>
 */
public class QualityEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QualityEngine.class);

    private final CatalogDatabaseProvider databases;
    private final ProjectDatabaseLookup projects;
    private final QualityStore store;
    private final SessionStore sessions;
    private final AuditService audit;
    private final NormalizationWorkerPool workerPool;
    private final QualityAnalyzer analyzer;
    private final DuplicateMerger merger;
    private final ViolationEngine violations;
    private final SuggestionApplier applier;
    private final ProjectQualityAggregator aggregator;
    private final QualityStatsCache cache;
    private final AutoCloseable ownedProvider;

    private QualityEngine(Builder builder) {
        EngineOptions options = builder.options;
        Clock clock = builder.clock;
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        ObjectMapper mapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();

        this.databases = builder.catalogDatabases;
        this.ownedProvider = builder.ownedProvider;
        this.projects = builder.projectLookup;
        this.store = builder.qualityStore != null ? builder.qualityStore : new InMemoryQualityStore();
        this.audit = builder.auditService != null ? builder.auditService : new AuditService(clock);
        if (builder.sessionStore != null) {
            this.sessions = builder.sessionStore;
        } else if (options.getSessionFile() != null) {
            this.sessions = new JsonFileSessionStore(options.getSessionFile(), mapper);
        } else {
            this.sessions = new InMemorySessionStore();
        }
        EntityLock locks = builder.entityLock != null ? builder.entityLock : new LocalEntityLock(options.getLock());
        CatalogNormalizer normalizer = builder.normalizer != null ? builder.normalizer
                : new CatalogNormalizer(NameNormalizer.defaults(), new AttributeExtractor(), new CompletenessScorer(), clock);

        this.aggregator = new ProjectQualityAggregator(projects, databases, options.getAggregator(), metrics, tracing, clock);
        this.cache = new QualityStatsCache(aggregator, options.getCache(), metrics, builder.ticker, clock);
        List<DatabaseChangeListener> listeners = List.of(cache);

        DuplicateDetector detector = new DuplicateDetector(store, options.getDetection(), metrics, clock);
        this.violations = new ViolationEngine(ViolationRules.catalogue(), store, locks, metrics, audit, clock);
        SuggestionGenerator generator = new SuggestionGenerator(store, metrics, clock);
        this.analyzer = new QualityAnalyzer(detector, violations, generator, store, tracing);
        Predicate<String> running = this::normalizationRunning;
        this.merger = new DuplicateMerger(store, databases, locks, running, listeners, metrics, audit, clock);
        this.applier = new SuggestionApplier(store, databases, normalizer, locks, running, listeners, metrics,
                audit, clock);
        this.workerPool = new NormalizationWorkerPool(options.getWorkerPool(), sessions, databases, normalizer,
                analyzer, locks, listeners, metrics, tracing, audit, clock);

        log.info("QualityEngine initialized: concurrency={}, batchSize={}, cacheEnabled={}",
                options.getWorkerPool().concurrency(), options.getWorkerPool().batchSize(), options.getCache().enabled());
    }

    // ========== Normalization API ==========

    /**
     * Starts normalization for one database or all active databases of a project.
     * Nothing starts when any targeted database already has a running session.
     *
     * @throws ValidationException for a global scope or a project without active databases
     * @throws ConflictException   with reason {@link ConflictReason#ALREADY_RUNNING}
     */
    public StartResult startNormalization(NormalizationScope scope) {
        List<TargetDatabase> targets = switch (scope.kind()) {
            case DATABASE -> List.of(TargetDatabase.ofPath(scope.databasePath()));
            case PROJECT -> projects.activeDatabases(scope.projectId());
            case GLOBAL -> throw new ValidationException("start needs a database_path or all_active with a project");
        };
        if (targets.isEmpty()) {
            throw new ValidationException("Project has no active databases: " + scope.projectId());
        }
        List<String> ids = workerPool.start(targets).stream().map(NormalizationSession::id).toList();
        String message = ids.size() == 1
                ? "Normalization started"
                : "Normalization started for " + ids.size() + " databases";
        return new StartResult(true, message, ids);
    }

    /**
     * Signals the running sessions in scope. Stopping when nothing runs succeeds.
     */
    public StopResponse stopNormalization(NormalizationScope scope) {
        StopResult result = workerPool.stop(databaseMatcher(scope));
        String message = result.wasRunning()
                ? "Stop requested for " + result.sessionIds().size() + " session(s)"
                : "No normalization running";
        return new StopResponse(true, message, result.wasRunning(), result.sessionIds());
    }

    /**
     * Status of the latest session per database in scope; for the global scope, of all running
     * sessions or, when none runs, of the latest one.
     */
    public NormalizationStatus normalizationStatus(NormalizationScope scope) {
        workerPool.reapStale();
        List<NormalizationSession> covered = switch (scope.kind()) {
            case DATABASE -> sessions.latestFor(scope.databasePath()).stream().toList();
            case PROJECT -> projects.activeDatabases(scope.projectId()).stream()
                    .flatMap(db -> sessions.latestFor(db.filePath()).stream())
                    .toList();
            case GLOBAL -> {
                List<NormalizationSession> running = sessions.running();
                yield !running.isEmpty() ? running : sessions.all().stream()
                        .max(Comparator.comparing(NormalizationSession::startedAt))
                        .stream().toList();
            }
        };
        return NormalizationStatus.of(covered);
    }

    public NormalizationSession session(String sessionId) {
        return sessions.find(sessionId).orElseThrow(() -> NotFoundException.of("Session", sessionId));
    }

    /**
     * Runs the analysis pass over one database without normalizing it.
     *
     * @throws ConflictException when a normalization session is running against the database
     */
    public AnalysisSummary analyzeDatabase(String databasePath) {
        if (databasePath == null || databasePath.isBlank()) {
            throw new ValidationException("database_path is required");
        }
        if (normalizationRunning(databasePath)) {
            throw new ConflictException(ConflictReason.ALREADY_RUNNING,
                    "Normalization is running for " + databasePath, List.of(databasePath));
        }
        AnalysisSummary summary = analyzer.analyze(databases.open(TargetDatabase.ofPath(databasePath)), step -> { });
        cache.onDatabaseChanged(databasePath);
        return summary;
    }

    private boolean normalizationRunning(String databasePath) {
        return sessions.latestFor(databasePath).filter(NormalizationSession::isRunning).isPresent();
    }

    // ========== Duplicates ==========

    public Page<DuplicateGroup> listDuplicates(DuplicateFilter filter, PageRequest page) {
        Predicate<String> inScope = databaseFilter(filter.database(), filter.projectId());
        return Page.of(store.groups(g -> inScope.test(g.getDatabaseKey())
                && (!filter.unmergedOnly() || !g.isMerged())), page);
    }

    public DuplicateGroup duplicateGroup(long groupId) {
        return store.findGroup(groupId).orElseThrow(() -> NotFoundException.of("Duplicate group", groupId));
    }

    /**
     * @throws ConflictException when the group is already merged
     */
    public MergeResult mergeDuplicateGroup(long groupId) {
        return merger.merge(groupId);
    }

    // ========== Violations ==========

    public Page<Violation> listViolations(ViolationFilter filter, PageRequest page) {
        Predicate<String> inScope = databaseFilter(filter.database(), filter.projectId());
        String search = filter.search() == null || filter.search().isBlank()
                ? null : filter.search().toLowerCase(Locale.ROOT);
        return Page.of(store.violations(v -> inScope.test(v.getDatabaseKey())
                && (filter.showResolved() || !v.isResolved())
                && (filter.severity() == null || filter.severity() == v.getSeverity())
                && (filter.category() == null || filter.category() == v.getCategory())
                && (search == null || matches(search, v.getMessage(), v.getRuleName(), v.getCurrentValue()))), page);
    }

    /**
     * Resolving twice succeeds and keeps the first resolver.
     */
    public Violation resolveViolation(long violationId, String resolvedBy) {
        return violations.resolve(violationId, resolvedBy);
    }

    // ========== Suggestions ==========

    public Page<Suggestion> listSuggestions(SuggestionFilter filter, PageRequest page) {
        Predicate<String> inScope = databaseFilter(filter.database(), filter.projectId());
        return Page.of(store.suggestions(s -> inScope.test(s.getDatabaseKey())
                && (filter.priority() == null || filter.priority() == s.getPriority())
                && (filter.type() == null || filter.type() == s.getType())
                && (filter.applied() == null || filter.applied() == s.isApplied())
                && (filter.autoApplyable() == null || filter.autoApplyable() == s.isAutoApplyable())), page);
    }

    /**
     * @throws ConflictException when the suggestion was already applied
     */
    public Suggestion applySuggestion(long suggestionId) {
        return applier.apply(suggestionId);
    }

    // ========== Statistics ==========

    public ProjectStats projectStats(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("project_id is required");
        }
        return cache.get(projectId);
    }

    public DatabaseStats databaseStats(String databasePath) {
        if (databasePath == null || databasePath.isBlank()) {
            throw new ValidationException("database is required");
        }
        return aggregator.getDatabaseStats(TargetDatabase.ofPath(databasePath));
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * Drops the cached stats of one project, or of all projects when the id is null.
     */
    public void invalidateCache(String projectId) {
        if (projectId == null) {
            cache.invalidateAll();
        } else {
            cache.invalidate(projectId);
        }
        audit.record(AuditAction.CACHE_INVALIDATED, projectId == null ? "cache:all" : "cache:" + projectId);
    }

    public AuditService getAuditService() {
        return audit;
    }

    @Override
    public void close() {
        workerPool.close();
        aggregator.close();
        if (ownedProvider != null) {
            try {
                ownedProvider.close();
            } catch (Exception e) {
                log.warn("Error closing catalog database provider", e);
            }
        }
    }

    private Predicate<String> databaseMatcher(NormalizationScope scope) {
        return switch (scope.kind()) {
            case DATABASE -> scope.databasePath()::equals;
            case PROJECT -> projectKeys(scope.projectId())::contains;
            case GLOBAL -> key -> true;
        };
    }

    private Predicate<String> databaseFilter(String database, String projectId) {
        Predicate<String> filter = key -> true;
        if (database != null && !database.isBlank()) {
            filter = filter.and(database::equals);
        }
        if (projectId != null && !projectId.isBlank()) {
            filter = filter.and(projectKeys(projectId)::contains);
        }
        return filter;
    }

    private Set<String> projectKeys(String projectId) {
        return projects.activeDatabases(projectId).stream()
                .map(TargetDatabase::filePath)
                .collect(Collectors.toSet());
    }

    private static boolean matches(String needle, String... haystack) {
        for (String value : haystack) {
            if (value != null && value.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogDatabaseProvider catalogDatabases;
        private AutoCloseable ownedProvider;
        private ProjectDatabaseLookup projectLookup;
        private QualityStore qualityStore;
        private SessionStore sessionStore;
        private CatalogNormalizer normalizer;
        private EntityLock entityLock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;
        private ObjectMapper objectMapper;
        private EngineOptions options = EngineOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private Ticker ticker = Ticker.systemTicker();

        /**
         * Sets where target databases are opened.
         */
        public Builder catalogDatabases(CatalogDatabaseProvider catalogDatabases) {
            this.catalogDatabases = catalogDatabases;
            this.ownedProvider = null;
            return this;
        }

        /**
         * Opens target databases as FalkorDB graphs on the given server; closed with the engine.
         */
        public Builder falkorDB(String host, int port) {
            FalkorDBCatalogDatabaseProvider provider = new FalkorDBCatalogDatabaseProvider(host, port,
                    objectMapper != null ? objectMapper : new ObjectMapper());
            this.catalogDatabases = provider;
            this.ownedProvider = provider;
            return this;
        }

        public Builder projectLookup(ProjectDatabaseLookup projectLookup) {
            this.projectLookup = projectLookup;
            return this;
        }

        public Builder qualityStore(QualityStore qualityStore) {
            this.qualityStore = qualityStore;
            return this;
        }

        public Builder sessionStore(SessionStore sessionStore) {
            this.sessionStore = sessionStore;
            return this;
        }

        public Builder normalizer(CatalogNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder entityLock(EntityLock entityLock) {
            this.entityLock = entityLock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Time source for cache freshness.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public QualityEngine build() {
            Objects.requireNonNull(catalogDatabases, "catalogDatabases is required");
            Objects.requireNonNull(projectLookup, "projectLookup is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            Objects.requireNonNull(ticker, "ticker is required");
            return new QualityEngine(this);
        }
    }
}
