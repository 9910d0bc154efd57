package com.catalog.quality.session;

import com.catalog.quality.core.model.NormalizationSession;
import com.catalog.quality.core.model.SessionStatus;
import com.catalog.quality.error.InternalException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

/**
 * {@link SessionStore} that writes every change through to a JSON file and reloads it on
 * construction, so run state survives a restart.
 */
public class JsonFileSessionStore extends InMemorySessionStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionStore.class);

    private static final TypeReference<List<StoredSession>> SESSIONS = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileSessionStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
        load();
    }

    private synchronized void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<StoredSession> stored = mapper.readValue(file.toFile(), SESSIONS);
            stored.forEach(s -> put(s.toSession()));
            log.info("session.store.loaded file={} sessions={}", file, stored.size());
        } catch (IOException e) {
            throw new InternalException("Cannot read session file " + file, e);
        }
    }

    @Override
    protected void changed() {
        List<StoredSession> snapshot = all().stream().map(StoredSession::of).toList();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new InternalException("Cannot write session file " + file, e);
        }
    }

    /**
     * On-disk shape. Instants are epoch milliseconds, absent ones null.
     */
    record StoredSession(
            @JsonProperty("id") String id,
            @JsonProperty("database") String database,
            @JsonProperty("status") String status,
            @JsonProperty("processed") long processed,
            @JsonProperty("total") long total,
            @JsonProperty("failed") long failed,
            @JsonProperty("current_step") String currentStep,
            @JsonProperty("duplicates_found") int duplicatesFound,
            @JsonProperty("violations_found") int violationsFound,
            @JsonProperty("suggestions_found") int suggestionsFound,
            @JsonProperty("error") String error,
            @JsonProperty("started_at") Long startedAt,
            @JsonProperty("last_heartbeat_at") Long lastHeartbeatAt,
            @JsonProperty("ended_at") Long endedAt,
            @JsonProperty("timeout_seconds") long timeoutSeconds
    ) {
        static StoredSession of(NormalizationSession s) {
            return new StoredSession(s.id(), s.databaseKey(), s.status().wireName(), s.processed(), s.total(),
                    s.failed(), s.currentStep(), s.duplicatesFound(), s.violationsFound(), s.suggestionsFound(),
                    s.error(), millis(s.startedAt()), millis(s.lastHeartbeatAt()), millis(s.endedAt()),
                    s.timeoutSeconds());
        }

        NormalizationSession toSession() {
            return new NormalizationSession(id, database, SessionStatus.fromWireName(status), processed, total,
                    failed, currentStep, duplicatesFound, violationsFound, suggestionsFound, error,
                    instant(startedAt), instant(lastHeartbeatAt), instant(endedAt), timeoutSeconds);
        }

        private static Long millis(Instant instant) {
            return instant == null ? null : instant.toEpochMilli();
        }

        private static Instant instant(Long millis) {
            return millis == null ? null : Instant.ofEpochMilli(millis);
        }
    }
}
