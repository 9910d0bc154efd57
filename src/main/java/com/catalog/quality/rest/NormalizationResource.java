package com.catalog.quality.rest;

import com.catalog.quality.api.NormalizationScope;
import com.catalog.quality.api.QualityEngine;
import com.catalog.quality.rest.dto.AnalysisResponse;
import com.catalog.quality.rest.dto.ErrorResponse;
import com.catalog.quality.rest.dto.NormalizationRequest;
import com.catalog.quality.rest.dto.StartResponse;
import com.catalog.quality.rest.dto.StatusResponse;
import com.catalog.quality.rest.dto.StopResponseDto;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource controlling normalization sessions.
 */
@Path("/api/v1/normalization")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Normalization", description = "Start, stop and monitor normalization of catalog databases")
public class NormalizationResource {

    private static final String BASE = "/api/v1/normalization";

    private final QualityEngine engine;

    @Inject
    public NormalizationResource(QualityEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/normalization/start
     */
    @POST
    @Path("/start")
    @Operation(summary = "Start normalization",
            description = "Starts one session per targeted database. Nothing starts when any target is already running.")
    @APIResponse(responseCode = "200", description = "Sessions started")
    @APIResponse(responseCode = "400", description = "Missing or invalid scope")
    @APIResponse(responseCode = "409", description = "A targeted database already has a running session")
    public Response start(NormalizationRequest request) {
        try {
            if (request == null) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(ErrorResponse.badRequest("Request body is required", BASE + "/start"))
                        .build();
            }
            return Responses.ok(StartResponse.from(engine.startNormalization(request.toScope(false))));
        } catch (RuntimeException e) {
            return Responses.failure("normalization.start", e, BASE + "/start");
        }
    }

    /**
     * POST /api/v1/normalization/stop
     */
    @POST
    @Path("/stop")
    @Operation(summary = "Stop normalization",
            description = "Requests a cooperative stop; sessions end after their current batch. An empty body stops everything.")
    @APIResponse(responseCode = "200", description = "Stop requested, or nothing was running")
    public Response stop(NormalizationRequest request) {
        try {
            NormalizationScope scope = request == null ? NormalizationScope.global() : request.toScope(true);
            return Responses.ok(StopResponseDto.from(engine.stopNormalization(scope)));
        } catch (RuntimeException e) {
            return Responses.failure("normalization.stop", e, BASE + "/stop");
        }
    }

    /**
     * GET /api/v1/normalization/status?database_path=...|project_id=...
     */
    @GET
    @Path("/status")
    @Operation(summary = "Normalization status", description = "Progress of the sessions in scope.")
    public Response status(
            @Parameter(description = "Database path") @QueryParam("database_path") String databasePath,
            @Parameter(description = "Project id") @QueryParam("project_id") String projectId) {
        try {
            return Responses.ok(StatusResponse.from(engine.normalizationStatus(
                    new NormalizationRequest(false, databasePath, projectId).toScope(true))));
        } catch (RuntimeException e) {
            return Responses.failure("normalization.status", e, BASE + "/status");
        }
    }

    /**
     * POST /api/v1/normalization/analyze
     */
    @POST
    @Path("/analyze")
    @Operation(summary = "Analyze database",
            description = "Detects duplicates and violations and generates suggestions without normalizing.")
    @APIResponse(responseCode = "409", description = "Normalization is running for the database")
    public Response analyze(NormalizationRequest request) {
        try {
            String path = request == null ? null : request.databasePath();
            return Responses.ok(AnalysisResponse.from(engine.analyzeDatabase(path)));
        } catch (RuntimeException e) {
            return Responses.failure("normalization.analyze", e, BASE + "/analyze");
        }
    }
}
