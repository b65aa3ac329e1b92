package com.codematch.core.session;

import com.codematch.core.model.VerificationSession;

import java.util.Optional;

/**
 * Narrow seam over wherever sessions live. Owns session lifecycle (create, persist, destroy);
 * core components only read and write sessions handed to them.
 */
public interface SessionStore {

    VerificationSession getOrCreate(String sessionId);

    Optional<VerificationSession> find(String sessionId);

    /**
     * Persists changes made to a session obtained from this store.
     */
    void save(VerificationSession session);

    void destroy(String sessionId);

    int size();
}
