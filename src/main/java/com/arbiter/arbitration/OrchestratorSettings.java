package com.arbiter.arbitration;

/**
 * Orchestrator options. {@code precedentConfidenceThreshold} is compared
 * strictly: a verdict at exactly the threshold creates no precedent.
 */
public record OrchestratorSettings(
    boolean autoApplyPrecedents,
    boolean enableWaivers,
    boolean enableAppeals,
    int maxConcurrentSessions,
    long sessionTimeoutMs,
    boolean trackPerformance,
    int precedentLookupLimit,
    double precedentConfidenceThreshold
) {

    public OrchestratorSettings {
        if (maxConcurrentSessions < 1) {
            throw new IllegalArgumentException("maxConcurrentSessions must be at least 1");
        }
        if (sessionTimeoutMs < 1) {
            throw new IllegalArgumentException("sessionTimeoutMs must be positive");
        }
        if (precedentLookupLimit < 0) {
            throw new IllegalArgumentException("precedentLookupLimit must not be negative");
        }
        if (precedentConfidenceThreshold < 0.0 || precedentConfidenceThreshold > 1.0) {
            throw new IllegalArgumentException("precedentConfidenceThreshold must be within [0, 1]");
        }
    }

    public static OrchestratorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean autoApplyPrecedents = true;
        private boolean enableWaivers = true;
        private boolean enableAppeals = true;
        private int maxConcurrentSessions = 10;
        private long sessionTimeoutMs = 300_000;
        private boolean trackPerformance = true;
        private int precedentLookupLimit = 5;
        private double precedentConfidenceThreshold = 0.8;

        private Builder() {
        }

        public Builder autoApplyPrecedents(boolean value) {
            this.autoApplyPrecedents = value;
            return this;
        }

        public Builder enableWaivers(boolean value) {
            this.enableWaivers = value;
            return this;
        }

        public Builder enableAppeals(boolean value) {
            this.enableAppeals = value;
            return this;
        }

        public Builder maxConcurrentSessions(int value) {
            this.maxConcurrentSessions = value;
            return this;
        }

        public Builder sessionTimeoutMs(long value) {
            this.sessionTimeoutMs = value;
            return this;
        }

        public Builder trackPerformance(boolean value) {
            this.trackPerformance = value;
            return this;
        }

        public Builder precedentLookupLimit(int value) {
            this.precedentLookupLimit = value;
            return this;
        }

        public Builder precedentConfidenceThreshold(double value) {
            this.precedentConfidenceThreshold = value;
            return this;
        }

        public OrchestratorSettings build() {
            return new OrchestratorSettings(autoApplyPrecedents, enableWaivers, enableAppeals,
                maxConcurrentSessions, sessionTimeoutMs, trackPerformance,
                precedentLookupLimit, precedentConfidenceThreshold);
        }
    }
}
