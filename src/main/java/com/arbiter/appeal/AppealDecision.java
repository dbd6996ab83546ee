package com.arbiter.appeal;

import com.arbiter.verdict.Verdict;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated result of an appeal review.
 *
 * @param newVerdict the replacement verdict; present if and only if the decision is OVERTURNED
 */
public record AppealDecision(
    String appealId,
    AppealOutcome decision,
    String reasoning,
    double confidence,
    List<ReviewerVote> votes,
    Verdict newVerdict,
    Instant decidedAt
) {

    public AppealDecision {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        if ((decision == AppealOutcome.OVERTURNED) != (newVerdict != null)) {
            throw new IllegalArgumentException("a replacement verdict is required exactly when overturning");
        }
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public boolean isOverturned() {
        return decision == AppealOutcome.OVERTURNED;
    }
}
