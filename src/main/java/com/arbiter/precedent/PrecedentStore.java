package com.arbiter.precedent;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for precedents. Implementations must make each appended
 * precedent visible atomically and never allow it to change afterwards.
 */
public interface PrecedentStore {

    /** Reserves the next creation sequence number. */
    long nextSequence();

    Precedent append(Precedent precedent);

    Optional<Precedent> findById(String precedentId);

    /** All precedents, in append order. */
    List<Precedent> findAll();

    long count();

    void clear();
}
