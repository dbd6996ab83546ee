package com.arbiter.waiver;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of assessing a waiver request, before any decision is recorded.
 *
 * @param recommendedDuration null when the waiver should not be approved
 * @param partial             approved with conditions or a reduced duration
 */
public record WaiverEvaluation(
    boolean shouldApprove,
    boolean partial,
    String reasoning,
    double confidence,
    List<String> conditions,
    Duration recommendedDuration
) {

    public WaiverEvaluation {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    static WaiverEvaluation reject(String reasoning, double confidence) {
        return new WaiverEvaluation(false, false, reasoning, confidence, List.of(), null);
    }
}
