package com.catalog.quality.rest.dto;

import com.catalog.quality.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        String timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now().toString(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, Map<String, String> details) {
        this(status, error, message, path, Instant.now().toString(), details);
    }

    public static int statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> 400;
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
            case UPSTREAM -> 502;
            case INTERNAL -> 500;
        };
    }

    public static ErrorResponse of(ErrorKind kind, String message, String path, Map<String, String> details) {
        return new ErrorResponse(statusOf(kind), reasonOf(kind), message, path, details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    private static String reasonOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Bad Request";
            case NOT_FOUND -> "Not Found";
            case CONFLICT -> "Conflict";
            case UPSTREAM -> "Bad Gateway";
            case INTERNAL -> "Internal Server Error";
        };
    }
}
