package com.catalog.quality.rest;

import com.catalog.quality.api.DuplicateFilter;
import com.catalog.quality.api.PageRequest;
import com.catalog.quality.api.QualityEngine;
import com.catalog.quality.api.SuggestionFilter;
import com.catalog.quality.api.ViolationFilter;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.rest.dto.CacheStatsResponse;
import com.catalog.quality.rest.dto.DuplicateGroupResponse;
import com.catalog.quality.rest.dto.ErrorResponse;
import com.catalog.quality.rest.dto.ListResponse;
import com.catalog.quality.rest.dto.ResolveViolationRequest;
import com.catalog.quality.rest.dto.StatsResponse;
import com.catalog.quality.rest.dto.SuccessResponse;
import com.catalog.quality.rest.dto.SuggestionResponse;
import com.catalog.quality.rest.dto.ViolationResponse;
import com.catalog.quality.store.InMemoryCatalogDatabase;
import com.catalog.quality.store.InMemoryCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryProjectDatabaseLookup;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class QualityResourceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String DB = "/data/catalog.db";

    private QualityEngine engine;
    private QualityResource resource;

    @BeforeEach
    void setUp() {
        InMemoryCatalogDatabaseProvider provider = new InMemoryCatalogDatabaseProvider();
        InMemoryCatalogDatabase database = provider.create(DB);
        seed(database, "r1", "CODE001", "Болт М8", 0.8);
        seed(database, "r2", "CODE001", "Болт М8 длинный", 0.8);
        seed(database, "r3", "C-3", "ГАЙКА М10", 0.65);
        InMemoryProjectDatabaseLookup lookup = new InMemoryProjectDatabaseLookup()
                .register("p1", new TargetDatabase(1, "Catalog", DB, true));

        engine = QualityEngine.builder()
                .catalogDatabases(provider)
                .projectLookup(lookup)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
        engine.analyzeDatabase(DB);
        resource = new QualityResource(engine);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static void seed(InMemoryCatalogDatabase database, String reference, String code, String name,
                             double quality) {
        database.seed(NormalizedRecord.builder()
                .databaseKey(DB)
                .reference(reference)
                .code(code)
                .name(name)
                .normalizedName(name.toLowerCase())
                .qualityScore(quality)
                .createdAt(NOW)
                .build());
    }

    private static ErrorResponse error(Response response) {
        return (ErrorResponse) response.getEntity();
    }

    @Nested
    @DisplayName("Duplicates")
    class DuplicateTests {

        @Test
        @DisplayName("Should list groups under their collection name")
        @SuppressWarnings("unchecked")
        void testList() {
            Response response = resource.listDuplicates(DB, null, false, 50, 0);

            assertEquals(200, response.getStatus());
            ListResponse<DuplicateGroupResponse> body = (ListResponse<DuplicateGroupResponse>) response.getEntity();
            assertEquals(1, body.total());
            assertEquals("groups", body.itemsName());
            assertEquals(1, body.namedItems().size());
        }

        @Test
        @DisplayName("Should merge once, then conflict")
        void testMerge() {
            long groupId = engine.listDuplicates(DuplicateFilter.all(),
                    PageRequest.defaults()).items().get(0).getId();

            Response first = resource.mergeDuplicates(groupId);
            Response second = resource.mergeDuplicates(groupId);

            assertEquals(200, first.getStatus());
            assertTrue(((SuccessResponse) first.getEntity()).success());
            assertEquals(409, second.getStatus());
            assertEquals("already_merged", error(second).details().get("reason"));
        }

        @Test
        @DisplayName("Should report an unknown group")
        void testMergeUnknown() {
            Response response = resource.mergeDuplicates(999);

            assertEquals(404, response.getStatus());
            assertEquals("/api/v1/quality/duplicates/999/merge", error(response).path());
        }

        @Test
        @DisplayName("Should reject an invalid page size")
        void testBadPage() {
            assertEquals(400, resource.listDuplicates(null, null, false, 0, 0).getStatus());
        }
    }

    @Nested
    @DisplayName("Violations")
    class ViolationTests {

        @Test
        @DisplayName("Should filter by severity wire name")
        @SuppressWarnings("unchecked")
        void testList() {
            Response info = resource.listViolations(DB, null, "info", null, false, null, 50, 0);
            Response critical = resource.listViolations(DB, null, "critical", null, false, null, 50, 0);

            assertEquals(1, ((ListResponse<ViolationResponse>) info.getEntity()).total());
            assertEquals(0, ((ListResponse<ViolationResponse>) critical.getEntity()).total());
        }

        @Test
        @DisplayName("Should reject an unknown severity")
        void testBadSeverity() {
            assertEquals(400, resource.listViolations(DB, null, "fatal", null, false, null, 50, 0).getStatus());
        }

        @Test
        @DisplayName("Should resolve idempotently and require a body")
        void testResolve() {
            long id = engine.listViolations(ViolationFilter.all(),
                    PageRequest.defaults()).items().get(0).getId();

            assertEquals(400, resource.resolveViolation(id, null).getStatus());
            assertEquals(200, resource.resolveViolation(id, new ResolveViolationRequest("editor")).getStatus());
            Response again = resource.resolveViolation(id, new ResolveViolationRequest("auditor"));
            assertEquals(200, again.getStatus());
            assertEquals("Resolved by editor", ((SuccessResponse) again.getEntity()).message());
            assertEquals(404, resource.resolveViolation(999, new ResolveViolationRequest("editor")).getStatus());
        }
    }

    @Nested
    @DisplayName("Suggestions")
    class SuggestionTests {

        @Test
        @DisplayName("Should apply a format suggestion once")
        @SuppressWarnings("unchecked")
        void testApply() {
            Response list = resource.listSuggestions(DB, null, null, "correct_format", false, null, 50, 0);
            ListResponse<SuggestionResponse> body = (ListResponse<SuggestionResponse>) list.getEntity();
            assertEquals(1, body.total());
            long id = engine.listSuggestions(SuggestionFilter.all(),
                    PageRequest.defaults()).items().stream()
                    .filter(s -> s.getType().writesField())
                    .findFirst().orElseThrow().getId();

            assertEquals(200, resource.applySuggestion(id).getStatus());
            assertEquals(409, resource.applySuggestion(id).getStatus());
        }

        @Test
        @DisplayName("Should refuse to apply a merge suggestion")
        void testApplyMerge() {
            long id = engine.listSuggestions(SuggestionFilter.all(),
                    PageRequest.defaults()).items().stream()
                    .filter(s -> !s.getType().writesField())
                    .findFirst().orElseThrow().getId();

            assertEquals(400, resource.applySuggestion(id).getStatus());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("Should return project and database statistics")
        void testStats() {
            Response project = resource.stats("p1", null);
            Response database = resource.stats(null, DB);

            assertEquals(200, project.getStatus());
            assertEquals(3, ((StatsResponse) project.getEntity()).totalItems());
            assertEquals(1, ((StatsResponse) project.getEntity()).databasesCount());
            assertNull(((StatsResponse) database.getEntity()).databases());
        }

        @Test
        @DisplayName("Should map missing input, unknown projects and unreachable databases")
        void testStatsErrors() {
            assertEquals(400, resource.stats(null, null).getStatus());
            assertEquals(404, resource.stats("nope", null).getStatus());
            Response unreachable = resource.stats(null, "/data/missing.db");
            assertEquals(502, unreachable.getStatus());
            assertEquals("/data/missing.db", error(unreachable).details().get("database"));
        }

        @Test
        @DisplayName("Should expose and clear the cache")
        void testCache() {
            resource.stats("p1", null);
            resource.stats("p1", null);

            CacheStatsResponse stats = (CacheStatsResponse) resource.cacheStats().getEntity();
            assertTrue(stats.enabled());
            assertEquals(1, stats.stats().totalHits());

            assertEquals(200, resource.invalidateCache(null).getStatus());
            assertEquals(0, ((CacheStatsResponse) resource.cacheStats().getEntity()).stats().totalEntries());
        }
    }
}
