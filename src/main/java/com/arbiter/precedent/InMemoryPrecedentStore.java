package com.arbiter.precedent;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryPrecedentStore implements PrecedentStore {

    private final CopyOnWriteArrayList<Precedent> precedents = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Precedent> byId = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    @Override
    public Precedent append(Precedent precedent) {
        if (byId.putIfAbsent(precedent.id(), precedent) != null) {
            throw new IllegalArgumentException("precedent already exists: " + precedent.id());
        }
        precedents.add(precedent);
        return precedent;
    }

    @Override
    public Optional<Precedent> findById(String precedentId) {
        return Optional.ofNullable(byId.get(precedentId));
    }

    @Override
    public List<Precedent> findAll() {
        return List.copyOf(precedents);
    }

    @Override
    public long count() {
        return precedents.size();
    }

    @Override
    public void clear() {
        precedents.clear();
        byId.clear();
        sequence.set(0);
    }
}
