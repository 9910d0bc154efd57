package com.catalog.quality.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted run state of one normalization pass over one database.
 *
 * @param id                 session id
 * @param databaseKey        target database identity (its file path)
 * @param status             lifecycle status
 * @param processed          items processed so far, failed items included
 * @param total              items expected, or -1 when unknown
 * @param failed             items that failed and were skipped
 * @param currentStep        human-readable step name
 * @param duplicatesFound    duplicate groups created by the analysis pass
 * @param violationsFound    violations created by the analysis pass
 * @param suggestionsFound   suggestions created by the analysis pass
 * @param error              failure description, null unless failed
 * @param startedAt          start instant
 * @param lastHeartbeatAt    last progress update, used for staleness checks
 * @param endedAt            terminal instant, null while running
 * @param timeoutSeconds     hard run limit
 */
public record NormalizationSession(
        String id,
        String databaseKey,
        SessionStatus status,
        long processed,
        long total,
        long failed,
        String currentStep,
        int duplicatesFound,
        int violationsFound,
        int suggestionsFound,
        String error,
        Instant startedAt,
        Instant lastHeartbeatAt,
        Instant endedAt,
        long timeoutSeconds
) {
    public NormalizationSession {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(databaseKey, "databaseKey is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        if (lastHeartbeatAt == null) {
            lastHeartbeatAt = startedAt;
        }
    }

    /**
     * Creates a fresh running session.
     */
    public static NormalizationSession start(String id, String databaseKey, long timeoutSeconds, Instant now) {
        return new NormalizationSession(id, databaseKey, SessionStatus.RUNNING, 0, -1, 0,
                "starting", 0, 0, 0, null, now, now, null, timeoutSeconds);
    }

    public boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    /**
     * Progress as a percentage in [0, 100]; 0 while the total is unknown.
     */
    public double progressPercent() {
        if (total <= 0) {
            return status == SessionStatus.COMPLETED ? 100.0 : 0.0;
        }
        return Math.min(100.0, processed * 100.0 / total);
    }

    /**
     * A running session is stale when its heartbeat is older than the staleness window
     * or when it has exceeded its timeout.
     */
    public boolean isStale(Instant now, Duration heartbeatStaleness) {
        if (!isRunning()) {
            return false;
        }
        boolean heartbeatLost = lastHeartbeatAt.plus(heartbeatStaleness).isBefore(now);
        boolean timedOut = timeoutSeconds > 0 && startedAt.plusSeconds(timeoutSeconds).isBefore(now);
        return heartbeatLost || timedOut;
    }

    public NormalizationSession withTotal(long newTotal) {
        return new NormalizationSession(id, databaseKey, status, processed, newTotal, failed, currentStep,
                duplicatesFound, violationsFound, suggestionsFound, error, startedAt, lastHeartbeatAt, endedAt,
                timeoutSeconds);
    }

    public NormalizationSession withProgress(long newProcessed, long newFailed, Instant heartbeat) {
        return new NormalizationSession(id, databaseKey, status, newProcessed, total, newFailed, currentStep,
                duplicatesFound, violationsFound, suggestionsFound, error, startedAt, heartbeat, endedAt,
                timeoutSeconds);
    }

    public NormalizationSession withStep(String step, Instant heartbeat) {
        return new NormalizationSession(id, databaseKey, status, processed, total, failed, step,
                duplicatesFound, violationsFound, suggestionsFound, error, startedAt, heartbeat, endedAt,
                timeoutSeconds);
    }

    public NormalizationSession withAnalysis(int duplicates, int violations, int suggestions) {
        return new NormalizationSession(id, databaseKey, status, processed, total, failed, currentStep,
                duplicates, violations, suggestions, error, startedAt, lastHeartbeatAt, endedAt, timeoutSeconds);
    }

    /**
     * Moves the session to a terminal status.
     *
     * @throws IllegalArgumentException if the target status is not terminal
     */
    public NormalizationSession finish(SessionStatus terminal, String errorMessage, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return new NormalizationSession(id, databaseKey, terminal, processed, total, failed, terminal.wireName(),
                duplicatesFound, violationsFound, suggestionsFound, errorMessage, startedAt, now, now,
                timeoutSeconds);
    }
}
