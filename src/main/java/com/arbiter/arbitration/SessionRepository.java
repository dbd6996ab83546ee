package com.arbiter.arbitration;

import java.util.Collection;
import java.util.Optional;

/**
 * Session registry shared by all callers. Implementations must allow
 * concurrent insert, lookup and removal.
 */
public interface SessionRepository {

    void save(ArbitrationSession session);

    Optional<ArbitrationSession> findById(String sessionId);

    Collection<ArbitrationSession> findAll();

    long count();

    void clear();
}
