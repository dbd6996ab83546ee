package com.arbiter.arbitration;

public enum ArbitrationState {
    INITIALIZED,
    RULE_EVALUATION,
    EVIDENCE_COLLECTION,
    VERDICT_GENERATION,
    WAIVER_EVALUATION,
    APPEAL_REVIEW,
    DEBATE_IN_PROGRESS,
    COMPLETED,
    FAILED;

    /** COMPLETED can still be reopened for appeal; FAILED cannot. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
