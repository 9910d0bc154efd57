package com.catalog.quality.rest;

import com.catalog.quality.api.DuplicateFilter;
import com.catalog.quality.api.PageRequest;
import com.catalog.quality.api.QualityEngine;
import com.catalog.quality.api.SuggestionFilter;
import com.catalog.quality.api.ViolationFilter;
import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.SuggestionPriority;
import com.catalog.quality.core.model.SuggestionType;
import com.catalog.quality.core.model.ViolationCategory;
import com.catalog.quality.rest.dto.CacheStatsResponse;
import com.catalog.quality.rest.dto.DuplicateGroupResponse;
import com.catalog.quality.rest.dto.ErrorResponse;
import com.catalog.quality.rest.dto.ListResponse;
import com.catalog.quality.rest.dto.ResolveViolationRequest;
import com.catalog.quality.rest.dto.StatsResponse;
import com.catalog.quality.rest.dto.SuccessResponse;
import com.catalog.quality.rest.dto.SuggestionResponse;
import com.catalog.quality.rest.dto.ViolationResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.function.Function;

/**
 * REST resource for duplicates, violations, suggestions and quality statistics.
 *
 * <p>Merge and apply succeed once and answer 409 on repeat. Resolve answers 200 every time.</p>
 */
@Path("/api/v1/quality")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Quality", description = "Duplicate groups, rule violations, suggestions and statistics")
public class QualityResource {

    private static final String BASE = "/api/v1/quality";

    private final QualityEngine engine;

    @Inject
    public QualityResource(QualityEngine engine) {
        this.engine = engine;
    }

    // ========== Duplicates ==========

    @GET
    @Path("/duplicates")
    @Operation(summary = "List duplicate groups", description = "Id-ordered, paginated by limit and offset.")
    public Response listDuplicates(
            @QueryParam("database") String database,
            @QueryParam("project_id") String projectId,
            @QueryParam("unmerged") @DefaultValue("false") boolean unmerged,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        try {
            return Responses.ok(ListResponse.from("groups",
                    engine.listDuplicates(new DuplicateFilter(database, projectId, unmerged),
                            PageRequest.of(offset, limit)),
                    DuplicateGroupResponse::from));
        } catch (RuntimeException e) {
            return Responses.failure("duplicates.list", e, BASE + "/duplicates");
        }
    }

    @POST
    @Path("/duplicates/{id}/merge")
    @Operation(summary = "Merge duplicate group", description = "Folds the group into its suggested master record.")
    @APIResponse(responseCode = "200", description = "Group merged")
    @APIResponse(responseCode = "404", description = "Group not found")
    @APIResponse(responseCode = "409", description = "Group already merged")
    public Response mergeDuplicates(@Parameter(description = "Duplicate group id") @PathParam("id") long groupId) {
        String path = BASE + "/duplicates/" + groupId + "/merge";
        try {
            var result = engine.mergeDuplicateGroup(groupId);
            return Responses.ok(SuccessResponse.ok("Merged " + result.deactivatedIds().size()
                    + " record(s) into " + result.masterId()));
        } catch (RuntimeException e) {
            return Responses.failure("duplicates.merge", e, path);
        }
    }

    // ========== Violations ==========

    @GET
    @Path("/violations")
    @Operation(summary = "List violations", description = "Open violations by default; id-ordered and paginated.")
    public Response listViolations(
            @QueryParam("database") String database,
            @QueryParam("project_id") String projectId,
            @QueryParam("severity") String severity,
            @QueryParam("category") String category,
            @QueryParam("show_resolved") @DefaultValue("false") boolean showResolved,
            @QueryParam("search") String search,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        try {
            ViolationFilter filter = new ViolationFilter(database, projectId,
                    parse(severity, Severity::fromWireName), parse(category, ViolationCategory::fromWireName),
                    showResolved, search);
            return Responses.ok(ListResponse.from("violations",
                    engine.listViolations(filter, PageRequest.of(offset, limit)), ViolationResponse::from));
        } catch (RuntimeException e) {
            return Responses.failure("violations.list", e, BASE + "/violations");
        }
    }

    @POST
    @Path("/violations/{id}/resolve")
    @Operation(summary = "Resolve violation", description = "Idempotent; a repeat keeps the first resolver.")
    @APIResponse(responseCode = "200", description = "Violation resolved")
    @APIResponse(responseCode = "404", description = "Violation not found")
    public Response resolveViolation(@Parameter(description = "Violation id") @PathParam("id") long violationId,
                                     ResolveViolationRequest request) {
        String path = BASE + "/violations/" + violationId + "/resolve";
        try {
            if (request == null) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(ErrorResponse.badRequest("resolved_by is required", path))
                        .build();
            }
            var resolved = engine.resolveViolation(violationId, request.resolvedBy());
            return Responses.ok(SuccessResponse.ok("Resolved by " + resolved.getResolvedBy()));
        } catch (RuntimeException e) {
            return Responses.failure("violations.resolve", e, path);
        }
    }

    // ========== Suggestions ==========

    @GET
    @Path("/suggestions")
    @Operation(summary = "List suggestions", description = "Id-ordered and paginated.")
    public Response listSuggestions(
            @QueryParam("database") String database,
            @QueryParam("project_id") String projectId,
            @QueryParam("priority") String priority,
            @QueryParam("type") String type,
            @QueryParam("applied") Boolean applied,
            @QueryParam("auto_applyable") Boolean autoApplyable,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        try {
            SuggestionFilter filter = new SuggestionFilter(database, projectId,
                    parse(priority, SuggestionPriority::fromWireName), parse(type, SuggestionType::fromWireName),
                    applied, autoApplyable);
            return Responses.ok(ListResponse.from("suggestions",
                    engine.listSuggestions(filter, PageRequest.of(offset, limit)), SuggestionResponse::from));
        } catch (RuntimeException e) {
            return Responses.failure("suggestions.list", e, BASE + "/suggestions");
        }
    }

    @POST
    @Path("/suggestions/{id}/apply")
    @Operation(summary = "Apply suggestion", description = "Writes the suggested value into the record once.")
    @APIResponse(responseCode = "200", description = "Suggestion applied")
    @APIResponse(responseCode = "400", description = "Suggestion type cannot be applied")
    @APIResponse(responseCode = "404", description = "Suggestion not found")
    @APIResponse(responseCode = "409", description = "Suggestion already applied")
    public Response applySuggestion(@Parameter(description = "Suggestion id") @PathParam("id") long suggestionId) {
        String path = BASE + "/suggestions/" + suggestionId + "/apply";
        try {
            var applied = engine.applySuggestion(suggestionId);
            return Responses.ok(SuccessResponse.ok("Applied to field " + applied.getField()));
        } catch (RuntimeException e) {
            return Responses.failure("suggestions.apply", e, path);
        }
    }

    // ========== Statistics ==========

    @GET
    @Path("/stats")
    @Operation(summary = "Quality statistics",
            description = "Project statistics (cached) when project_id is given, else statistics of one database.")
    public Response stats(@QueryParam("project_id") String projectId, @QueryParam("database") String database) {
        try {
            if (projectId != null && !projectId.isBlank()) {
                return Responses.ok(StatsResponse.from(engine.projectStats(projectId)));
            }
            if (database != null && !database.isBlank()) {
                return Responses.ok(StatsResponse.from(engine.databaseStats(database)));
            }
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("project_id or database is required", BASE + "/stats"))
                    .build();
        } catch (RuntimeException e) {
            return Responses.failure("stats.get", e, BASE + "/stats");
        }
    }

    @GET
    @Path("/cache/stats")
    @Operation(summary = "Cache statistics")
    public Response cacheStats() {
        try {
            return Responses.ok(CacheStatsResponse.from(engine.cacheStats()));
        } catch (RuntimeException e) {
            return Responses.failure("cache.stats", e, BASE + "/cache/stats");
        }
    }

    @POST
    @Path("/cache/invalidate")
    @Operation(summary = "Invalidate cache", description = "Drops one project's entry, or all entries without project_id.")
    public Response invalidateCache(@QueryParam("project_id") String projectId) {
        try {
            engine.invalidateCache(projectId == null || projectId.isBlank() ? null : projectId);
            return Responses.ok(SuccessResponse.ok(projectId == null ? "Cache cleared" : "Cache entry removed"));
        } catch (RuntimeException e) {
            return Responses.failure("cache.invalidate", e, BASE + "/cache/invalidate");
        }
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        return value == null || value.isBlank() ? null : parser.apply(value);
    }
}
