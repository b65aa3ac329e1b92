package com.codematch.core.session;

import com.codematch.core.config.CodematchProperties;
import com.codematch.core.model.VerificationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Sessions idle longer than the configured timeout are
 * evicted lazily whenever the store is accessed.
 */
@Component
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentHashMap<String, VerificationSession> sessions = new ConcurrentHashMap<>();
    private final long maxSessionBytes;
    private final Duration idleTimeout;
    private final Clock clock;

    public InMemorySessionStore(CodematchProperties properties) {
        this(properties.getMaxSessionBytes(),
                Duration.ofMinutes(properties.getSessionIdleTimeoutMinutes()),
                Clock.systemUTC());
    }

    InMemorySessionStore(long maxSessionBytes, Duration idleTimeout, Clock clock) {
        this.maxSessionBytes = maxSessionBytes;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    @Override
    public VerificationSession getOrCreate(String sessionId) {
        evictExpired();
        VerificationSession session = sessions.computeIfAbsent(sessionId, id -> {
            log.debug("Creating session {}", id);
            return new VerificationSession(id, maxSessionBytes);
        });
        session.touch(clock.instant());
        return session;
    }

    @Override
    public Optional<VerificationSession> find(String sessionId) {
        evictExpired();
        VerificationSession session = sessions.get(sessionId);
        if (session != null) {
            session.touch(clock.instant());
        }
        return Optional.ofNullable(session);
    }

    @Override
    public void save(VerificationSession session) {
        sessions.put(session.getId(), session);
    }

    @Override
    public void destroy(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Session {} cleared", sessionId);
        }
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        sessions.entrySet().removeIf(entry -> {
            boolean expired = entry.getValue().getLastAccessedAt().isBefore(cutoff);
            if (expired) {
                log.info("Evicting idle session {}", entry.getKey());
            }
            return expired;
        });
    }
}
