package com.arbiter.arbitration;

/**
 * Per-session phase timings and counts. Updated by the orchestrator at each
 * phase boundary; frozen once the final state is terminal. Reopening a
 * completed session for appeal thaws it until the session terminates again.
 */
public class SessionMetrics {

    private final String sessionId;

    private volatile long ruleEvaluationMs;
    private volatile long precedentLookupMs;
    private volatile long verdictGenerationMs;
    private volatile Long waiverEvaluationMs;
    private volatile Long appealReviewMs;
    private volatile int rulesEvaluated;
    private volatile int precedentsFound;
    private volatile long totalDurationMs;
    private volatile ArbitrationState finalState;
    private volatile int reopenCount;

    SessionMetrics(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getRuleEvaluationMs() {
        return ruleEvaluationMs;
    }

    public long getPrecedentLookupMs() {
        return precedentLookupMs;
    }

    public long getVerdictGenerationMs() {
        return verdictGenerationMs;
    }

    public Long getWaiverEvaluationMs() {
        return waiverEvaluationMs;
    }

    public Long getAppealReviewMs() {
        return appealReviewMs;
    }

    public int getRulesEvaluated() {
        return rulesEvaluated;
    }

    public int getPrecedentsFound() {
        return precedentsFound;
    }

    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public ArbitrationState getFinalState() {
        return finalState;
    }

    public int getReopenCount() {
        return reopenCount;
    }

    public boolean isFinal() {
        return finalState != null && finalState.isTerminal();
    }

    void recordRuleEvaluation(long millis, int count) {
        if (isFinal()) {
            return;
        }
        this.ruleEvaluationMs = millis;
        this.rulesEvaluated = count;
    }

    void recordPrecedentLookup(long millis, int found) {
        if (isFinal()) {
            return;
        }
        this.precedentLookupMs = millis;
        this.precedentsFound = found;
    }

    void recordVerdictGeneration(long millis) {
        if (isFinal()) {
            return;
        }
        this.verdictGenerationMs = millis;
    }

    void recordWaiverEvaluation(long millis) {
        if (isFinal()) {
            return;
        }
        this.waiverEvaluationMs = millis;
    }

    void recordAppealReview(long millis) {
        if (isFinal()) {
            return;
        }
        this.appealReviewMs = millis;
    }

    void close(ArbitrationState state, long totalMillis) {
        if (isFinal()) {
            return;
        }
        this.totalDurationMs = totalMillis;
        this.finalState = state;
    }

    void reopen() {
        this.finalState = null;
        this.reopenCount++;
    }
}
