package com.catalog.quality.store;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.RawCatalogItem;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link CatalogDatabase} stored in one FalkorDB graph.
 *
 * <p>Raw items are {@code :RawItem} nodes ordered by {@code seq}; normalized records are
 * {@code :Record} nodes keyed by {@code reference}. Attributes are kept as a JSON string.
 * A multi-record update is a single query; in-process readers wait for it on a read/write lock.</p>
 */
public class GraphCatalogDatabase implements CatalogDatabase {
    private static final Logger log = LoggerFactory.getLogger(GraphCatalogDatabase.class);

    private static final TypeReference<Map<String, String>> ATTRIBUTES = new TypeReference<>() {
    };

    private static final String RECORD_COLUMNS =
            "r.id AS id, r.reference AS reference, r.code AS code, r.name AS name, "
                    + "r.normalizedName AS normalizedName, r.attributes AS attributes, "
                    + "r.processingLevel AS processingLevel, r.qualityScore AS qualityScore, "
                    + "r.aiConfidence AS aiConfidence, r.active AS active, r.mergedCount AS mergedCount, "
                    + "r.createdAt AS createdAt, r.updatedAt AS updatedAt";

    private static final String SET_RECORD =
            "SET r.id = $id, r.code = $code, r.name = $name, r.normalizedName = $normalizedName, "
                    + "r.attributes = $attributes, r.processingLevel = $processingLevel, "
                    + "r.qualityScore = $qualityScore, r.aiConfidence = $aiConfidence, r.active = $active, "
                    + "r.mergedCount = $mergedCount, r.createdAt = $createdAt, r.updatedAt = $updatedAt";

    private static final String UPDATE_ROWS =
            "UNWIND $rows AS row MATCH (r:Record {reference: row.reference}) " + SET_RECORD.replace("$", "row.");

    private final String key;
    private final GraphConnection connection;
    private final ObjectMapper mapper;
    private final AtomicLong ids;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public GraphCatalogDatabase(String key, GraphConnection connection, ObjectMapper mapper) {
        this.key = key;
        this.connection = connection;
        this.mapper = mapper;
        this.ids = new AtomicLong(guarded(this::maxId));
    }

    @Override
    public String key() {
        return key;
    }

    /**
     * Appends a raw item node, used by ingestion tooling and tests.
     */
    public void addRawItem(long seq, RawCatalogItem item) {
        guarded(() -> {
            connection.execute(
                    "CREATE (:RawItem {seq: $seq, reference: $reference, code: $code, name: $name, payload: $payload})",
                    params("seq", seq, "reference", item.reference(), "code", item.code(),
                            "name", item.name(), "payload", item.payload()));
            return null;
        });
    }

    @Override
    public RawItemCursor openRawItems() {
        long total = guarded(() -> asLong(first(connection.query(
                "MATCH (i:RawItem) RETURN count(i) AS total")).get("total"), 0));
        return new RawItemCursor() {
            private long skip;

            @Override
            public List<RawCatalogItem> nextBatch(int max) {
                List<Map<String, Object>> rows = guarded(() -> connection.query(
                        "MATCH (i:RawItem) RETURN i.reference AS reference, i.code AS code, i.name AS name, "
                                + "i.payload AS payload ORDER BY i.seq SKIP $skip LIMIT $limit",
                        params("skip", skip, "limit", max)));
                skip += rows.size();
                return rows.stream()
                        .map(row -> new RawCatalogItem(
                                asString(row.get("reference")),
                                asString(row.get("code")),
                                asString(row.get("name")),
                                asString(row.get("payload"))))
                        .toList();
            }

            @Override
            public long total() {
                return total;
            }
        };
    }

    @Override
    public NormalizedRecord upsert(NormalizedRecord record) {
        lock.writeLock().lock();
        try {
            Optional<NormalizedRecord> existing = guarded(() -> connection.query(
                    "MATCH (r:Record {reference: $reference}) RETURN " + RECORD_COLUMNS,
                    params("reference", record.getReference()))).stream().findFirst().map(this::toRecord);
            NormalizedRecord stored = existing
                    .map(old -> record.toBuilder()
                            .id(old.getId())
                            .databaseKey(key)
                            .createdAt(old.getCreatedAt())
                            .updatedAt(Instant.now())
                            .active(old.isActive())
                            .mergedCount(old.getMergedCount())
                            .build())
                    .orElseGet(() -> record.toBuilder().id(ids.incrementAndGet()).databaseKey(key).build());
            write("MERGE (r:Record {reference: $reference}) " + SET_RECORD, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<NormalizedRecord> findById(long id) {
        return guarded(() -> connection.query(
                "MATCH (r:Record {id: $id}) RETURN " + RECORD_COLUMNS, params("id", id)))
                .stream().findFirst().map(this::toRecord);
    }

    @Override
    public void updateAll(List<NormalizedRecord> changed, Runnable alongside) {
        lock.writeLock().lock();
        try {
            List<NormalizedRecord> previous = new ArrayList<>(changed.size());
            for (NormalizedRecord record : changed) {
                previous.add(findById(record.getId())
                        .orElseThrow(() -> NotFoundException.of("Record", key + "#" + record.getId())));
            }
            try (StoreTransaction tx = new StoreTransaction("update " + changed.size() + " records in " + key)) {
                tx.step("write records", () -> writeAll(changed), () -> writeAll(previous));
                alongside.run();
                tx.commit();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<NormalizedRecord> activeRecords() {
        return reading(() -> guarded(() -> connection.query(
                "MATCH (r:Record) WHERE r.active = true RETURN " + RECORD_COLUMNS + " ORDER BY r.id"))
                .stream().map(this::toRecord).toList());
    }

    @Override
    public Map<ProcessingLevel, LevelTally> levelTallies() {
        List<Map<String, Object>> rows = reading(() -> guarded(() -> connection.query(
                "MATCH (r:Record) WHERE r.active = true "
                        + "RETURN r.processingLevel AS level, count(r) AS cnt, sum(r.qualityScore) AS total")));
        Map<ProcessingLevel, LevelTally> tallies = new EnumMap<>(ProcessingLevel.class);
        for (Map<String, Object> row : rows) {
            ProcessingLevel level = ProcessingLevel.fromWireName(asString(row.get("level")));
            tallies.put(level, new LevelTally(level, asLong(row.get("cnt"), 0), asDouble(row.get("total"))));
        }
        return tallies;
    }

    @Override
    public long recordCount() {
        return guarded(() -> asLong(first(connection.query(
                "MATCH (r:Record) RETURN count(r) AS total")).get("total"), 0));
    }

    private void write(String statement, NormalizedRecord record) {
        Map<String, Object> params = recordParams(record);
        guarded(() -> {
            connection.execute(statement, params);
            return null;
        });
    }

    private void writeAll(List<NormalizedRecord> records) {
        List<Map<String, Object>> rows = records.stream().map(this::recordParams).toList();
        guarded(() -> {
            connection.execute(UPDATE_ROWS, params("rows", rows));
            return null;
        });
    }

    private Map<String, Object> recordParams(NormalizedRecord record) {
        Map<String, Object> params = new HashMap<>();
        params.put("reference", record.getReference());
        params.put("id", record.getId());
        params.put("code", record.getCode());
        params.put("name", record.getName());
        params.put("normalizedName", record.getNormalizedName());
        params.put("attributes", writeAttributes(record.getAttributes()));
        params.put("processingLevel", record.getProcessingLevel().wireName());
        params.put("qualityScore", record.getQualityScore());
        params.put("aiConfidence", record.getAiConfidence());
        params.put("active", record.isActive());
        params.put("mergedCount", record.getMergedCount());
        params.put("createdAt", record.getCreatedAt().toEpochMilli());
        params.put("updatedAt", record.getUpdatedAt().toEpochMilli());
        return params;
    }

    NormalizedRecord toRecord(Map<String, Object> row) {
        return NormalizedRecord.builder()
                .id(asLong(row.get("id"), 0))
                .databaseKey(key)
                .reference(asString(row.get("reference")))
                .code(asString(row.get("code")))
                .name(asString(row.get("name")))
                .normalizedName(asString(row.get("normalizedName")))
                .attributes(readAttributes(asString(row.get("attributes"))))
                .processingLevel(ProcessingLevel.fromWireName(asString(row.get("processingLevel"))))
                .qualityScore(asDouble(row.get("qualityScore")))
                .aiConfidence(asDouble(row.get("aiConfidence")))
                .active(!Boolean.FALSE.equals(row.get("active")))
                .mergedCount((int) asLong(row.get("mergedCount"), 0))
                .createdAt(Instant.ofEpochMilli(asLong(row.get("createdAt"), 0)))
                .updatedAt(Instant.ofEpochMilli(asLong(row.get("updatedAt"), 0)))
                .build();
    }

    private long maxId() {
        return asLong(first(connection.query("MATCH (r:Record) RETURN max(r.id) AS maxId")).get("maxId"), 0);
    }

    private String writeAttributes(Map<String, String> attributes) {
        try {
            return mapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(key, "Cannot serialize attributes", e);
        }
    }

    private Map<String, String> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, ATTRIBUTES);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(key, "Corrupt attributes in " + key, e);
        }
    }

    private <T> T reading(Supplier<T> read) {
        lock.readLock().lock();
        try {
            return read.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (UpstreamException | NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("graph.database.failed database={} error={}", key, e.getMessage());
            throw new UpstreamException(key, "Graph query failed for " + key + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }

    private static Map<String, Object> params(Object... pairs) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            params.put((String) pairs[i], pairs[i + 1]);
        }
        return params;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static long asLong(Object value, long fallback) {
        return value instanceof Number n ? n.longValue() : fallback;
    }

    private static double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
