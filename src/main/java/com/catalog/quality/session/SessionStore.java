package com.catalog.quality.session;

import com.catalog.quality.core.model.NormalizationSession;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Run state of normalization sessions, at most one running session per database.
 */
public interface SessionStore {

    /**
     * Stores all given sessions, or none of them when any of their databases already has a
     * running session.
     *
     * @throws com.catalog.quality.error.ConflictException listing the busy databases
     */
    void createAll(List<NormalizationSession> sessions);

    default void create(NormalizationSession session) {
        createAll(List.of(session));
    }

    Optional<NormalizationSession> find(String sessionId);

    /**
     * Latest session started against the database, running or not.
     */
    Optional<NormalizationSession> latestFor(String databaseKey);

    List<NormalizationSession> running();

    List<NormalizationSession> all();

    /**
     * Atomically replaces a session with the result of {@code change}.
     *
     * @throws com.catalog.quality.error.NotFoundException if the session is unknown
     */
    NormalizationSession update(String sessionId, UnaryOperator<NormalizationSession> change);
}
