package com.catalog.quality.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys put through a context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSession(sessionId, databasePath)) {
 *     log.info("normalization.batch.completed processed={}", processed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSession(String sessionId, String databaseKey) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("database", databaseKey);
        ctx.put("operation", "normalize");
        return ctx;
    }

    public static LogContext forAnalysis(String databaseKey) {
        LogContext ctx = new LogContext();
        ctx.put("database", databaseKey);
        ctx.put("operation", "analyze");
        return ctx;
    }

    public static LogContext forMerge(long groupId, String databaseKey) {
        LogContext ctx = new LogContext();
        ctx.put("groupId", Long.toString(groupId));
        ctx.put("database", databaseKey);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forAggregation(String projectId) {
        LogContext ctx = new LogContext();
        ctx.put("projectId", projectId);
        ctx.put("correlationId", newCorrelationId());
        ctx.put("operation", "aggregate");
        return ctx;
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
