package com.arbiter.verdict;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decision output of a session. Immutable: an overturning appeal produces a
 * new Verdict instead of editing this one.
 *
 * @param confidence in [0, 1]
 * @param precedents ids of the precedents that informed the decision
 */
public record Verdict(
    String id,
    String sessionId,
    VerdictOutcome outcome,
    List<ReasoningStep> reasoning,
    List<String> rulesApplied,
    List<String> evidence,
    List<String> precedents,
    List<String> conditions,
    double confidence,
    String issuedBy,
    Instant issuedAt
) {

    public Verdict {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
        rulesApplied = rulesApplied == null ? List.of() : List.copyOf(rulesApplied);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        precedents = precedents == null ? List.of() : List.copyOf(precedents);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /** Reasoning descriptions joined into one paragraph, in step order. */
    public String reasoningSummary() {
        return reasoning.stream()
            .map(ReasoningStep::description)
            .collect(Collectors.joining(". "));
    }
}
