package com.arbiter.arbitration;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentHashMap<String, ArbitrationSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(ArbitrationSession session) {
        sessions.put(session.getId(), session);
    }

    @Override
    public Optional<ArbitrationSession> findById(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Collection<ArbitrationSession> findAll() {
        return List.copyOf(sessions.values());
    }

    @Override
    public long count() {
        return sessions.size();
    }

    @Override
    public void clear() {
        sessions.clear();
    }
}
