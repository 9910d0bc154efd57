package com.catalog.quality.api;

import com.catalog.quality.core.model.NormalizationSession;

import java.util.Comparator;
import java.util.List;

/**
 * Status of the sessions a scope covers, summed over databases.
 *
 * @param progress percentage in [0, 100]
 * @param total    items expected, or -1 while any covered session has not counted its input
 */
public record NormalizationStatus(
        boolean isRunning,
        double progress,
        long processed,
        long total,
        String currentStep,
        int duplicatesFound,
        int violationsFound,
        int suggestionsFound,
        String error,
        List<NormalizationSession> sessions
) {

    public static final String IDLE = "idle";

    public NormalizationStatus {
        sessions = List.copyOf(sessions);
    }

    public static NormalizationStatus idle() {
        return new NormalizationStatus(false, 0.0, 0, 0, IDLE, 0, 0, 0, null, List.of());
    }

    static NormalizationStatus of(List<NormalizationSession> sessions) {
        if (sessions.isEmpty()) {
            return idle();
        }
        boolean running = false;
        boolean totalKnown = true;
        long processed = 0;
        long total = 0;
        int duplicates = 0;
        int violations = 0;
        int suggestions = 0;
        String error = null;
        for (NormalizationSession s : sessions) {
            running |= s.isRunning();
            processed += s.processed();
            if (s.total() < 0) {
                totalKnown = false;
            } else {
                total += s.total();
            }
            duplicates += s.duplicatesFound();
            violations += s.violationsFound();
            suggestions += s.suggestionsFound();
            if (error == null) {
                error = s.error();
            }
        }
        // the first running session's step, else the latest one's
        String step = sessions.stream().filter(NormalizationSession::isRunning).findFirst()
                .or(() -> sessions.stream().max(Comparator.comparing(NormalizationSession::startedAt)))
                .map(NormalizationSession::currentStep)
                .orElse(IDLE);
        double progress;
        if (sessions.size() == 1) {
            progress = sessions.get(0).progressPercent();
        } else {
            progress = totalKnown && total > 0 ? Math.min(100.0, processed * 100.0 / total) : 0.0;
        }
        return new NormalizationStatus(running, progress, processed, totalKnown ? total : -1, step,
                duplicates, violations, suggestions, error, sessions);
    }
}
