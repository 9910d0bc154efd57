package com.catalog.quality.duplicate;

import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.similarity.BlockingKeys;
import com.catalog.quality.store.QualityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Groups the active records of one database into duplicate clusters.
 *
 * <p>Exact strategies bucket records by code and by match key and join each bucket whole,
 * however large. Fuzzy strategies compare only records sharing a blocking key, and skip a block
 * larger than {@link DetectionThresholds#maxBlockSize()}. Matched pairs are joined with
 * union-find, so a record lands in at most one group per run. A cluster already stored as an unmerged group with the same
 * members is not stored again.</p>
 */
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final QualityStore store;
    private final DetectionThresholds thresholds;
    private final MetricsService metrics;
    private final Clock clock;

    public DuplicateDetector(QualityStore store, DetectionThresholds thresholds, MetricsService metrics, Clock clock) {
        this.store = store;
        this.thresholds = thresholds;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Detects clusters among the given records and stores the new ones.
     *
     * @param databaseKey database the records belong to
     * @param records     candidate records; inactive ones are ignored
     * @return groups created by this call
     */
    public List<DuplicateGroup> detect(String databaseKey, Collection<NormalizedRecord> records) {
        Map<Long, NormalizedRecord> byId = new TreeMap<>();
        for (NormalizedRecord record : records) {
            if (record.isActive() && databaseKey.equals(record.getDatabaseKey())) {
                byId.put(record.getId(), record);
            }
        }
        Map<Long, Map<Long, DetectionMethod.PairMatch>> edges = findPairs(new ArrayList<>(byId.values()));
        List<Set<Long>> clusters = cluster(byId.keySet(), edges);

        Set<Set<Long>> existing = new HashSet<>();
        for (DuplicateGroup group : store.groups(g -> !g.isMerged() && databaseKey.equals(g.getDatabaseKey()))) {
            existing.add(new HashSet<>(group.getMemberIds()));
        }

        List<DuplicateGroup> created = new ArrayList<>();
        for (Set<Long> cluster : clusters) {
            if (existing.contains(cluster)) {
                continue;
            }
            DuplicateGroup group = store.insertGroup(toGroup(databaseKey, cluster, byId, edges));
            created.add(group);
            metrics.recordGroupDetected(group.getDetectionMethod());
            log.debug("duplicates.group.created groupId={} method={} members={}",
                    group.getId(), group.getDetectionMethod().wireName(), group.getMemberIds());
        }
        log.info("duplicates.detection.completed database={} records={} clusters={} created={}",
                databaseKey, byId.size(), clusters.size(), created.size());
        return created;
    }

    private Map<Long, Map<Long, DetectionMethod.PairMatch>> findPairs(List<NormalizedRecord> records) {
        Map<Long, Map<Long, DetectionMethod.PairMatch>> edges = new HashMap<>();
        Set<Long> compared = new HashSet<>();

        // exact buckets link every member to the first one, whatever their size
        linkExact(bucket(records, r -> r.getCode().isEmpty() ? Set.of() : Set.of(r.getCode())).values(),
                DetectionMethod.EXACT_CODE, edges, compared);
        linkExact(bucket(records, r -> r.getNormalizedName().isEmpty() ? Set.of() : Set.of(r.getNormalizedName()))
                .values(), DetectionMethod.EXACT_NAME, edges, compared);

        for (Collection<NormalizedRecord> block : bucket(records, r -> BlockingKeys.of(r.getNormalizedName())).values()) {
            if (block.size() < 2) {
                continue;
            }
            if (block.size() > thresholds.maxBlockSize()) {
                log.debug("duplicates.block.skipped size={}", block.size());
                continue;
            }
            List<NormalizedRecord> members = new ArrayList<>(block);
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    NormalizedRecord a = members.get(i);
                    NormalizedRecord b = members.get(j);
                    long low = Math.min(a.getId(), b.getId());
                    long high = Math.max(a.getId(), b.getId());
                    if (!compared.add(pairKey(low, high))) {
                        continue;
                    }
                    DetectionMethod.classify(a, b, thresholds).ifPresent(match ->
                            edges.computeIfAbsent(low, k -> new HashMap<>()).put(high, match));
                }
            }
        }
        return edges;
    }

    private static void linkExact(Collection<List<NormalizedRecord>> buckets, DetectionMethod method,
                                  Map<Long, Map<Long, DetectionMethod.PairMatch>> edges, Set<Long> compared) {
        DetectionMethod.PairMatch match = new DetectionMethod.PairMatch(method, 1.0);
        for (List<NormalizedRecord> bucket : buckets) {
            long first = bucket.get(0).getId();
            for (NormalizedRecord record : bucket.subList(1, bucket.size())) {
                long low = Math.min(first, record.getId());
                long high = Math.max(first, record.getId());
                if (compared.add(pairKey(low, high))) {
                    edges.computeIfAbsent(low, k -> new HashMap<>()).put(high, match);
                }
            }
        }
    }

    // ids fit well below 2^31 per database
    private static long pairKey(long low, long high) {
        return low * 2_147_483_648L + high;
    }

    private static Map<String, List<NormalizedRecord>> bucket(List<NormalizedRecord> records,
                                                              Function<NormalizedRecord, Set<String>> keys) {
        Map<String, List<NormalizedRecord>> buckets = new HashMap<>();
        for (NormalizedRecord record : records) {
            for (String key : keys.apply(record)) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }
        return buckets;
    }

    private static List<Set<Long>> cluster(Set<Long> ids, Map<Long, Map<Long, DetectionMethod.PairMatch>> edges) {
        Map<Long, Long> parent = new HashMap<>();
        ids.forEach(id -> parent.put(id, id));
        edges.forEach((low, targets) -> targets.keySet().forEach(high -> union(parent, low, high)));

        Map<Long, Set<Long>> clusters = new TreeMap<>();
        for (Long id : ids) {
            clusters.computeIfAbsent(find(parent, id), k -> new TreeSet<>()).add(id);
        }
        return clusters.values().stream().filter(c -> c.size() > 1).toList();
    }

    private static long find(Map<Long, Long> parent, long id) {
        long root = id;
        while (parent.get(root) != root) {
            root = parent.get(root);
        }
        long node = id;
        while (node != root) {
            long next = parent.get(node);
            parent.put(node, root);
            node = next;
        }
        return root;
    }

    private static void union(Map<Long, Long> parent, long a, long b) {
        long rootA = find(parent, a);
        long rootB = find(parent, b);
        if (rootA != rootB) {
            parent.put(Math.max(rootA, rootB), Math.min(rootA, rootB));
        }
    }

    private DuplicateGroup toGroup(String databaseKey, Set<Long> cluster, Map<Long, NormalizedRecord> byId,
                                   Map<Long, Map<Long, DetectionMethod.PairMatch>> edges) {
        DetectionMethod tag = null;
        double score = 0.0;
        for (Long low : cluster) {
            for (DetectionMethod.PairMatch match : edges.getOrDefault(low, Map.of()).values()) {
                if (tag == null || match.method().ordinal() < tag.ordinal()) {
                    tag = match.method();
                    score = match.score();
                } else if (match.method() == tag) {
                    score = Math.max(score, match.score());
                }
            }
        }
        NormalizedRecord master = cluster.stream()
                .map(byId::get)
                .max(Comparator.comparingDouble(NormalizedRecord::getQualityScore)
                        .thenComparing(NormalizedRecord::getId, Comparator.reverseOrder()))
                .orElseThrow();
        return DuplicateGroup.builder()
                .databaseKey(databaseKey)
                .detectionMethod(tag)
                .similarityScore(Math.max(0.0, Math.min(1.0, score)))
                .suggestedMasterId(master.getId())
                .memberIds(List.copyOf(cluster))
                .createdAt(clock.instant())
                .build();
    }
}
