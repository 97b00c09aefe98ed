package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.exception.UnknownSessionException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the open interview sessions, one {@link AffectPipeline} each.
 */
@Service
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final AffectPipelineFactory factory;
    private final Map<String, AffectPipeline> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(AffectPipelineFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Opens a session, or returns the pipeline of an already-open one.
     *
     * @throws IllegalArgumentException if sessionId is blank
     */
    public AffectPipeline open(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return sessions.computeIfAbsent(sessionId, id -> {
            LOG.info("Opened session {}", id);
            return factory.create(id);
        });
    }

    /**
     * @throws UnknownSessionException if the session is not open
     */
    public AffectPipeline get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    public Optional<AffectPipeline> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Closes and forgets a session. Its outstanding captures are abandoned.
     *
     * @return true if the session was open
     */
    public boolean close(String sessionId) {
        AffectPipeline pipeline = sessionId == null ? null : sessions.remove(sessionId);
        if (pipeline == null) {
            return false;
        }
        pipeline.close();
        return true;
    }

    public int openCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (String id : sessions.keySet()) {
            close(id);
        }
    }
}
