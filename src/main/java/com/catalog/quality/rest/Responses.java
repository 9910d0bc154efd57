package com.catalog.quality.rest;

import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.QualityEngineException;
import com.catalog.quality.error.UpstreamException;
import com.catalog.quality.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps engine failures onto HTTP responses. Stack traces never reach the client.
 */
final class Responses {
    private static final Logger log = LoggerFactory.getLogger(Responses.class);

    private Responses() {
    }

    static Response ok(Object entity) {
        return Response.ok(entity).build();
    }

    static Response failure(String operation, RuntimeException e, String path) {
        if (e instanceof QualityEngineException qe) {
            ErrorResponse body = ErrorResponse.of(qe.getKind(), qe.getMessage(), path, details(qe));
            if (body.status() >= 500) {
                log.error("{}.failed kind={} error={}", operation, qe.getKind(), qe.getMessage(), qe);
            } else {
                log.debug("{}.rejected kind={} error={}", operation, qe.getKind(), qe.getMessage());
            }
            return Response.status(body.status()).entity(body).build();
        }
        if (e instanceof IllegalArgumentException) {
            log.debug("{}.rejected error={}", operation, e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
        log.error("{}.failed error={}", operation, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError("Internal error", path))
                .build();
    }

    private static Map<String, String> details(QualityEngineException e) {
        Map<String, String> details = new LinkedHashMap<>();
        if (e instanceof ConflictException ce) {
            details.put("reason", ce.getReason().name().toLowerCase(Locale.ROOT));
            if (!ce.getConflicts().isEmpty()) {
                details.put("conflicts", String.join(",", ce.getConflicts()));
            }
        } else if (e instanceof UpstreamException ue) {
            details.put("database", ue.getDatabaseKey());
        }
        return details.isEmpty() ? null : details;
    }
}
