package com.arbiter.waiver;

import com.arbiter.contract.RuleCategory;

import java.time.Duration;
import java.util.Set;

/**
 * @param minEvidenceForApproval evidence items below which approval is only conditional
 * @param nonWaivableCategories  categories rejected regardless of the rule's own flag
 */
public record WaiverPolicy(
    int minJustificationLength,
    int minEvidenceForApproval,
    boolean allowConditionalWaivers,
    Duration defaultDuration,
    Duration maxDuration,
    boolean autoRevokeOnExpiration,
    Set<RuleCategory> nonWaivableCategories
) {

    public WaiverPolicy {
        if (minJustificationLength < 0 || minEvidenceForApproval < 0) {
            throw new IllegalArgumentException("waiver minimums must not be negative");
        }
        if (defaultDuration == null || maxDuration == null) {
            throw new IllegalArgumentException("waiver durations are required");
        }
        if (defaultDuration.compareTo(maxDuration) > 0) {
            throw new IllegalArgumentException("default waiver duration exceeds maximum");
        }
        nonWaivableCategories = nonWaivableCategories == null ? Set.of() : Set.copyOf(nonWaivableCategories);
    }

    public static WaiverPolicy defaults() {
        return new WaiverPolicy(20, 2, true, Duration.ofDays(7), Duration.ofDays(30), true, Set.of());
    }

    public WaiverPolicy withMinEvidenceForApproval(int value) {
        return new WaiverPolicy(minJustificationLength, value, allowConditionalWaivers,
            defaultDuration, maxDuration, autoRevokeOnExpiration, nonWaivableCategories);
    }

    public WaiverPolicy withAllowConditionalWaivers(boolean value) {
        return new WaiverPolicy(minJustificationLength, minEvidenceForApproval, value,
            defaultDuration, maxDuration, autoRevokeOnExpiration, nonWaivableCategories);
    }

    public WaiverPolicy withMaxDuration(Duration value) {
        Duration defaultCapped = defaultDuration.compareTo(value) > 0 ? value : defaultDuration;
        return new WaiverPolicy(minJustificationLength, minEvidenceForApproval, allowConditionalWaivers,
            defaultCapped, value, autoRevokeOnExpiration, nonWaivableCategories);
    }

    public WaiverPolicy withAutoRevokeOnExpiration(boolean value) {
        return new WaiverPolicy(minJustificationLength, minEvidenceForApproval, allowConditionalWaivers,
            defaultDuration, maxDuration, value, nonWaivableCategories);
    }

    public WaiverPolicy withNonWaivableCategories(Set<RuleCategory> value) {
        return new WaiverPolicy(minJustificationLength, minEvidenceForApproval, allowConditionalWaivers,
            defaultDuration, maxDuration, autoRevokeOnExpiration, value);
    }
}
