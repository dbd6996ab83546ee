package com.arbiter.arbitration;

import com.arbiter.appeal.AppealPolicy;
import com.arbiter.contract.RuleCategory;
import com.arbiter.verdict.ConfidenceWeights;
import com.arbiter.waiver.WaiverPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Settings bound from the {@code arbitration} prefix of application.yml.
 */
@ConfigurationProperties(prefix = "arbitration")
public class ArbitrationProperties {

    private boolean autoApplyPrecedents = true;
    private boolean enableWaivers = true;
    private boolean enableAppeals = true;
    private int maxConcurrentSessions = 10;
    private long sessionTimeoutMs = 300_000;
    private boolean trackPerformance = true;
    private int precedentLookupLimit = 5;
    private double precedentConfidenceThreshold = 0.8;
    private long timeoutSweepIntervalMs = 30_000;

    private final Precedent precedent = new Precedent();
    private final Verdict verdict = new Verdict();
    private final Waiver waiver = new Waiver();
    private final Appeal appeal = new Appeal();

    public OrchestratorSettings toSettings() {
        return OrchestratorSettings.builder()
            .autoApplyPrecedents(autoApplyPrecedents)
            .enableWaivers(enableWaivers)
            .enableAppeals(enableAppeals)
            .maxConcurrentSessions(maxConcurrentSessions)
            .sessionTimeoutMs(sessionTimeoutMs)
            .trackPerformance(trackPerformance)
            .precedentLookupLimit(precedentLookupLimit)
            .precedentConfidenceThreshold(precedentConfidenceThreshold)
            .build();
    }

    public boolean isAutoApplyPrecedents() {
        return autoApplyPrecedents;
    }

    public void setAutoApplyPrecedents(boolean autoApplyPrecedents) {
        this.autoApplyPrecedents = autoApplyPrecedents;
    }

    public boolean isEnableWaivers() {
        return enableWaivers;
    }

    public void setEnableWaivers(boolean enableWaivers) {
        this.enableWaivers = enableWaivers;
    }

    public boolean isEnableAppeals() {
        return enableAppeals;
    }

    public void setEnableAppeals(boolean enableAppeals) {
        this.enableAppeals = enableAppeals;
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public void setMaxConcurrentSessions(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    public long getSessionTimeoutMs() {
        return sessionTimeoutMs;
    }

    public void setSessionTimeoutMs(long sessionTimeoutMs) {
        this.sessionTimeoutMs = sessionTimeoutMs;
    }

    public boolean isTrackPerformance() {
        return trackPerformance;
    }

    public void setTrackPerformance(boolean trackPerformance) {
        this.trackPerformance = trackPerformance;
    }

    public int getPrecedentLookupLimit() {
        return precedentLookupLimit;
    }

    public void setPrecedentLookupLimit(int precedentLookupLimit) {
        this.precedentLookupLimit = precedentLookupLimit;
    }

    public double getPrecedentConfidenceThreshold() {
        return precedentConfidenceThreshold;
    }

    public void setPrecedentConfidenceThreshold(double precedentConfidenceThreshold) {
        this.precedentConfidenceThreshold = precedentConfidenceThreshold;
    }

    public long getTimeoutSweepIntervalMs() {
        return timeoutSweepIntervalMs;
    }

    public void setTimeoutSweepIntervalMs(long timeoutSweepIntervalMs) {
        this.timeoutSweepIntervalMs = timeoutSweepIntervalMs;
    }

    public Precedent getPrecedent() {
        return precedent;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public Waiver getWaiver() {
        return waiver;
    }

    public Appeal getAppeal() {
        return appeal;
    }

    public static class Precedent {

        private double minSimilarity = 0.3;

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }
    }

    public static class Verdict {

        private double ruleWeight = 0.5;
        private double precedentWeight = 0.3;
        private double evidenceWeight = 0.2;
        private double minRejectConfidence = 0.5;

        public ConfidenceWeights toWeights() {
            return new ConfidenceWeights(ruleWeight, precedentWeight, evidenceWeight);
        }

        public double getRuleWeight() {
            return ruleWeight;
        }

        public void setRuleWeight(double ruleWeight) {
            this.ruleWeight = ruleWeight;
        }

        public double getPrecedentWeight() {
            return precedentWeight;
        }

        public void setPrecedentWeight(double precedentWeight) {
            this.precedentWeight = precedentWeight;
        }

        public double getEvidenceWeight() {
            return evidenceWeight;
        }

        public void setEvidenceWeight(double evidenceWeight) {
            this.evidenceWeight = evidenceWeight;
        }

        public double getMinRejectConfidence() {
            return minRejectConfidence;
        }

        public void setMinRejectConfidence(double minRejectConfidence) {
            this.minRejectConfidence = minRejectConfidence;
        }
    }

    public static class Waiver {

        private int minJustificationLength = 20;
        private int minEvidenceForApproval = 2;
        private boolean allowConditionalWaivers = true;
        private Duration defaultDuration = Duration.ofDays(7);
        private Duration maxDuration = Duration.ofDays(30);
        private boolean autoRevokeOnExpiration = true;
        private List<RuleCategory> nonWaivableCategories = new ArrayList<>();

        public WaiverPolicy toPolicy() {
            return new WaiverPolicy(minJustificationLength, minEvidenceForApproval, allowConditionalWaivers,
                defaultDuration, maxDuration, autoRevokeOnExpiration,
                nonWaivableCategories.isEmpty()
                    ? EnumSet.noneOf(RuleCategory.class)
                    : EnumSet.copyOf(nonWaivableCategories));
        }

        public int getMinJustificationLength() {
            return minJustificationLength;
        }

        public void setMinJustificationLength(int minJustificationLength) {
            this.minJustificationLength = minJustificationLength;
        }

        public int getMinEvidenceForApproval() {
            return minEvidenceForApproval;
        }

        public void setMinEvidenceForApproval(int minEvidenceForApproval) {
            this.minEvidenceForApproval = minEvidenceForApproval;
        }

        public boolean isAllowConditionalWaivers() {
            return allowConditionalWaivers;
        }

        public void setAllowConditionalWaivers(boolean allowConditionalWaivers) {
            this.allowConditionalWaivers = allowConditionalWaivers;
        }

        public Duration getDefaultDuration() {
            return defaultDuration;
        }

        public void setDefaultDuration(Duration defaultDuration) {
            this.defaultDuration = defaultDuration;
        }

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }

        public boolean isAutoRevokeOnExpiration() {
            return autoRevokeOnExpiration;
        }

        public void setAutoRevokeOnExpiration(boolean autoRevokeOnExpiration) {
            this.autoRevokeOnExpiration = autoRevokeOnExpiration;
        }

        public List<RuleCategory> getNonWaivableCategories() {
            return nonWaivableCategories;
        }

        public void setNonWaivableCategories(List<RuleCategory> nonWaivableCategories) {
            this.nonWaivableCategories = nonWaivableCategories;
        }
    }

    public static class Appeal {

        private int maxActiveAppealsPerAppellant = 1;
        private double majorityThreshold = 2.0 / 3.0;
        private int minReviewers = 1;

        public AppealPolicy toPolicy() {
            return new AppealPolicy(maxActiveAppealsPerAppellant, majorityThreshold, minReviewers);
        }

        public int getMaxActiveAppealsPerAppellant() {
            return maxActiveAppealsPerAppellant;
        }

        public void setMaxActiveAppealsPerAppellant(int maxActiveAppealsPerAppellant) {
            this.maxActiveAppealsPerAppellant = maxActiveAppealsPerAppellant;
        }

        public double getMajorityThreshold() {
            return majorityThreshold;
        }

        public void setMajorityThreshold(double majorityThreshold) {
            this.majorityThreshold = majorityThreshold;
        }

        public int getMinReviewers() {
            return minReviewers;
        }

        public void setMinReviewers(int minReviewers) {
            this.minReviewers = minReviewers;
        }
    }
}
