package com.arbiter.precedent;

import com.arbiter.verdict.Verdict;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record derived from a high-confidence or appeal-overturned
 * verdict. {@code sequence} is assigned by the store and orders precedents
 * by creation.
 */
public record Precedent(
    String id,
    String title,
    List<String> keyFacts,
    String reasoningSummary,
    List<String> rulesInvolved,
    PrecedentApplicability applicability,
    Verdict verdict,
    Instant createdAt,
    long sequence
) {

    public Precedent {
        keyFacts = keyFacts == null ? List.of() : List.copyOf(keyFacts);
        rulesInvolved = rulesInvolved == null ? List.of() : List.copyOf(rulesInvolved);
    }
}
