package com.arbiter.waiver;

import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.contract.ViolationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a rule violation may be excused and tracks the waivers it grants.
 *
 * Checks run in a fixed order and the first failing check decides:
 * <ol>
 *   <li>rule not waivable, or its category is listed as non-waivable</li>
 *   <li>request names a different rule</li>
 *   <li>an active waiver already exists for the rule</li>
 *   <li>justification shorter than the policy minimum</li>
 *   <li>too little evidence: conditional approval, or rejection when conditional waivers are off</li>
 *   <li>requested duration above the maximum: approved for the maximum</li>
 * </ol>
 * At most one waiver is active per rule. All methods are synchronized; the
 * interpreter is shared by every session.
 */
public class WaiverInterpreter {

    private static final Logger log = LoggerFactory.getLogger(WaiverInterpreter.class);

    static final double CERTAIN = 1.0;
    static final double APPROVED_CONFIDENCE = 0.85;
    static final double REDUCED_CONFIDENCE = 0.75;
    static final double CONDITIONAL_CONFIDENCE = 0.6;
    static final double POLICY_REJECTION_CONFIDENCE = 0.9;

    private final WaiverPolicy policy;
    private final Clock clock;

    private final Map<String, WaiverDecision> activeByRule = new LinkedHashMap<>();
    private final Map<String, WaiverDecision> history = new LinkedHashMap<>();

    public WaiverInterpreter() {
        this(WaiverPolicy.defaults());
    }

    public WaiverInterpreter(WaiverPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public WaiverInterpreter(WaiverPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public WaiverPolicy getPolicy() {
        return policy;
    }

    /** Assesses the request without recording anything. */
    public synchronized WaiverEvaluation evaluateWaiver(WaiverRequest request, ConstitutionalRule rule) {
        if (request == null || rule == null) {
            throw new IllegalArgumentException("waiver request and rule are required");
        }
        if (!rule.waivable() || policy.nonWaivableCategories().contains(rule.category())) {
            return WaiverEvaluation.reject("Rule " + rule.id() + " is not waivable", CERTAIN);
        }
        if (!rule.id().equals(request.ruleId())) {
            return WaiverEvaluation.reject("Waiver request references rule " + request.ruleId()
                + " but was evaluated against rule " + rule.id(), CERTAIN);
        }
        if (isWaiverActive(rule.id())) {
            return WaiverEvaluation.reject("Active waiver already exists for rule " + rule.id(),
                POLICY_REJECTION_CONFIDENCE);
        }

        String justification = request.justification() == null ? "" : request.justification().trim();
        if (justification.length() < policy.minJustificationLength()) {
            return WaiverEvaluation.reject("Insufficient justification: " + justification.length()
                + " characters, at least " + policy.minJustificationLength() + " required",
                POLICY_REJECTION_CONFIDENCE);
        }

        Duration requested = request.requestedDuration() == null
            ? policy.defaultDuration()
            : request.requestedDuration();
        Duration granted = requested.compareTo(policy.maxDuration()) > 0 ? policy.maxDuration() : requested;

        List<String> conditions = new ArrayList<>();
        if (rule.severity() == ViolationSeverity.CRITICAL) {
            conditions.add("Submit weekly progress reports on remediation of " + rule.id());
        }

        int evidenceCount = request.evidence().size();
        if (evidenceCount < policy.minEvidenceForApproval()) {
            if (!policy.allowConditionalWaivers()) {
                return WaiverEvaluation.reject("Insufficient evidence: " + evidenceCount + " items provided, "
                    + policy.minEvidenceForApproval() + " required", POLICY_REJECTION_CONFIDENCE);
            }
            conditions.add(0, "Provide at least " + policy.minEvidenceForApproval()
                + " supporting evidence items before the waiver expires");
            return new WaiverEvaluation(true, true, "Conditional approval: " + evidenceCount
                + " evidence items provided, " + policy.minEvidenceForApproval() + " expected",
                CONDITIONAL_CONFIDENCE, conditions, granted);
        }

        if (!granted.equals(requested)) {
            return new WaiverEvaluation(true, true, "Approved with reduced duration: requested "
                + requested + " exceeds maximum " + policy.maxDuration(), REDUCED_CONFIDENCE, conditions, granted);
        }
        return new WaiverEvaluation(true, false, "Approved: justification and evidence satisfy waiver policy",
            APPROVED_CONFIDENCE, conditions, granted);
    }

    /**
     * Evaluates the request and records the decision. An approval becomes
     * the rule's active waiver.
     */
    public synchronized WaiverDecision processWaiver(WaiverRequest request, ConstitutionalRule rule, String decidedBy) {
        WaiverEvaluation evaluation = evaluateWaiver(request, rule);
        Instant now = clock.instant();
        WaiverDecision decision;
        if (evaluation.shouldApprove()) {
            Duration duration = evaluation.recommendedDuration();
            Instant expiresAt = now.plus(duration);
            decision = new WaiverDecision(request.id(), rule.id(), WaiverStatus.APPROVED,
                evaluation.partial() ? WaiverOutcome.PARTIALLY_WAIVED : WaiverOutcome.WAIVED,
                evaluation.reasoning(), evaluation.conditions(), duration, expiresAt,
                policy.autoRevokeOnExpiration() ? expiresAt : null, decidedBy, now, evaluation.confidence());
            activeByRule.put(rule.id(), decision);
            log.info("Waiver {} approved for rule {} by {} (outcome={}, expiresAt={})",
                request.id(), rule.id(), decidedBy, decision.outcome(), expiresAt);
        } else {
            decision = new WaiverDecision(request.id(), rule.id(), WaiverStatus.REJECTED, WaiverOutcome.DENIED,
                evaluation.reasoning(), List.of(), null, null, null, decidedBy, now, evaluation.confidence());
            log.warn("Waiver {} rejected for rule {}: {}", request.id(), rule.id(), evaluation.reasoning());
        }
        history.put(request.id(), decision);
        return decision;
    }

    /** True while an approved waiver for the rule has not expired. Expired waivers are retired on access. */
    public synchronized boolean isWaiverActive(String ruleId) {
        return getActiveWaiver(ruleId).isPresent();
    }

    public synchronized Optional<WaiverDecision> getActiveWaiver(String ruleId) {
        WaiverDecision active = activeByRule.get(ruleId);
        if (active == null) {
            return Optional.empty();
        }
        if (active.isExpiredAt(clock.instant())) {
            if (policy.autoRevokeOnExpiration()) {
                retire(active, WaiverStatus.EXPIRED, "expired at " + active.expiresAt());
            }
            return Optional.empty();
        }
        return Optional.of(active);
    }

    public synchronized List<WaiverDecision> getActiveWaivers() {
        Instant now = clock.instant();
        return activeByRule.values().stream().filter(d -> !d.isExpiredAt(now)).toList();
    }

    /** @return false when the rule has no active waiver */
    public synchronized boolean revokeWaiver(String ruleId, String revokedBy, String reason) {
        Optional<WaiverDecision> active = getActiveWaiver(ruleId);
        if (active.isEmpty()) {
            return false;
        }
        retire(active.get(), WaiverStatus.REVOKED, "revoked by " + revokedBy + ": " + reason);
        log.info("Waiver {} for rule {} revoked by {}: {}", active.get().requestId(), ruleId, revokedBy, reason);
        return true;
    }

    /**
     * Extends the active waiver for the rule. The total approved duration may
     * not exceed the policy maximum.
     *
     * @return the extended decision, or empty when there is nothing to extend
     *         or the extension would exceed the maximum
     */
    public synchronized Optional<WaiverDecision> extendWaiver(String ruleId, Duration extension, String extendedBy) {
        if (extension == null || extension.isNegative() || extension.isZero()) {
            throw new IllegalArgumentException("extension must be positive");
        }
        Optional<WaiverDecision> active = getActiveWaiver(ruleId);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        WaiverDecision current = active.get();
        if (current.approvedDuration().plus(extension).compareTo(policy.maxDuration()) > 0) {
            log.warn("Extension of waiver {} by {} rejected: exceeds maximum {}",
                current.requestId(), extension, policy.maxDuration());
            return Optional.empty();
        }
        WaiverDecision extended = current.extendedBy(extension, "extended by " + extendedBy + " for " + extension,
            policy.autoRevokeOnExpiration());
        activeByRule.put(ruleId, extended);
        history.put(extended.requestId(), extended);
        log.info("Waiver {} for rule {} extended to {}", extended.requestId(), ruleId, extended.expiresAt());
        return Optional.of(extended);
    }

    /** Retires every expired active waiver. */
    public synchronized int cleanupExpiredWaivers() {
        Instant now = clock.instant();
        List<WaiverDecision> expired = activeByRule.values().stream().filter(d -> d.isExpiredAt(now)).toList();
        expired.forEach(d -> retire(d, WaiverStatus.EXPIRED, "expired at " + d.expiresAt()));
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired waivers", expired.size());
        }
        return expired.size();
    }

    public synchronized List<WaiverDecision> getWaiverHistory() {
        return List.copyOf(history.values());
    }

    public synchronized List<WaiverDecision> getWaiverHistory(String ruleId) {
        return history.values().stream().filter(d -> d.ruleId().equals(ruleId)).toList();
    }

    public synchronized WaiverStatistics getStatistics() {
        long approved = 0;
        long rejected = 0;
        long revoked = 0;
        long expired = 0;
        long durationTotal = 0;
        long withDuration = 0;
        for (WaiverDecision decision : history.values()) {
            switch (decision.status()) {
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
                case REVOKED -> revoked++;
                case EXPIRED -> expired++;
            }
            if (decision.approvedDuration() != null) {
                durationTotal += decision.approvedDuration().toMillis();
                withDuration++;
            }
        }
        double average = withDuration == 0 ? 0.0 : (double) durationTotal / withDuration;
        return new WaiverStatistics(history.size(), approved, rejected, revoked, expired,
            getActiveWaivers().size(), average);
    }

    public synchronized void clear() {
        activeByRule.clear();
        history.clear();
    }

    private void retire(WaiverDecision decision, WaiverStatus status, String note) {
        activeByRule.remove(decision.ruleId());
        history.put(decision.requestId(), decision.withStatus(status, note));
    }
}
