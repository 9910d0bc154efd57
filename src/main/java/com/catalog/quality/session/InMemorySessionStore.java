package com.catalog.quality.session;

import com.catalog.quality.core.model.NormalizationSession;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.ConflictException.ConflictReason;
import com.catalog.quality.error.NotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Heap-resident session table. All access is synchronized on the store, which keeps
 * the running-per-database check and the insert in one step.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, NormalizationSession> sessions = new LinkedHashMap<>();
    private final Map<String, String> latestByDatabase = new HashMap<>();

    @Override
    public synchronized void createAll(List<NormalizationSession> newSessions) {
        List<String> busy = new ArrayList<>();
        for (NormalizationSession session : newSessions) {
            String key = session.databaseKey();
            boolean running = latestFor(key).map(NormalizationSession::isRunning).orElse(false);
            if (running) {
                busy.add(key);
            }
        }
        if (!busy.isEmpty()) {
            throw new ConflictException(ConflictReason.ALREADY_RUNNING,
                    "Normalization already running for " + String.join(", ", busy), busy);
        }
        Map<String, String> previousLatest = new HashMap<>();
        for (NormalizationSession session : newSessions) {
            previousLatest.putIfAbsent(session.databaseKey(), latestByDatabase.get(session.databaseKey()));
            put(session);
        }
        try {
            changed();
        } catch (RuntimeException e) {
            newSessions.forEach(session -> sessions.remove(session.id()));
            previousLatest.forEach((key, id) -> {
                if (id == null) {
                    latestByDatabase.remove(key);
                } else {
                    latestByDatabase.put(key, id);
                }
            });
            throw e;
        }
    }

    @Override
    public synchronized Optional<NormalizationSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized Optional<NormalizationSession> latestFor(String databaseKey) {
        String id = latestByDatabase.get(databaseKey);
        return id == null ? Optional.empty() : Optional.ofNullable(sessions.get(id));
    }

    @Override
    public synchronized List<NormalizationSession> running() {
        return sessions.values().stream().filter(NormalizationSession::isRunning).toList();
    }

    @Override
    public synchronized List<NormalizationSession> all() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(NormalizationSession::startedAt))
                .toList();
    }

    @Override
    public synchronized NormalizationSession update(String sessionId, UnaryOperator<NormalizationSession> change) {
        NormalizationSession current = sessions.get(sessionId);
        if (current == null) {
            throw NotFoundException.of("Session", sessionId);
        }
        NormalizationSession next = change.apply(current);
        if (next != current) {
            sessions.put(sessionId, next);
            try {
                changed();
            } catch (RuntimeException e) {
                sessions.put(sessionId, current);
                throw e;
            }
        }
        return next;
    }

    /**
     * Loads a session without the running check, used when restoring persisted state.
     */
    protected void put(NormalizationSession session) {
        sessions.put(session.id(), session);
        latestByDatabase.merge(session.databaseKey(), session.id(), (oldId, newId) -> {
            NormalizationSession old = sessions.get(oldId);
            return old == null || !old.startedAt().isAfter(session.startedAt()) ? newId : oldId;
        });
    }

    /**
     * Called under the store lock after every mutation. When it throws, the mutation is undone.
     */
    protected void changed() {
    }
}
