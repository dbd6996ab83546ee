package com.arbiter.verdict;

import com.arbiter.contract.ConstitutionalViolation;
import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;
import com.arbiter.precedent.Precedent;
import com.arbiter.rules.EvidenceMatcher;
import com.arbiter.rules.RuleConditionStatus;
import com.arbiter.rules.RuleEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Synthesises a verdict from rule evaluations, precedents and evidence.
 *
 * <pre>
 * confidence = w_rule x r + w_precedent x p + w_evidence x e
 * </pre>
 * <ul>
 *   <li>r: strength of the strongest applying rule; when none applies, the
 *       share of evaluated rules whose condition is satisfied</li>
 *   <li>p: precedent agreement, 0.5 when no same-category precedent exists,
 *       moving towards 1 or 0 as agreeing or conflicting precedents dominate</li>
 *   <li>e: mean evidence coverage of the applying rules, else whether any
 *       evidence was supplied</li>
 * </ul>
 * Output depends only on the inputs; only the issue timestamp varies. The
 * verdict id carries the session id and the issue number within the session.
 */
public class VerdictGenerator {

    private static final Logger log = LoggerFactory.getLogger(VerdictGenerator.class);

    public static final double DEFAULT_MIN_REJECT_CONFIDENCE = 0.5;
    static final double NEUTRAL_AGREEMENT = 0.5;

    private final ConfidenceWeights weights;
    private final double minRejectConfidence;
    private final Clock clock;

    public VerdictGenerator() {
        this(ConfidenceWeights.defaults(), DEFAULT_MIN_REJECT_CONFIDENCE, Clock.systemUTC());
    }

    public VerdictGenerator(ConfidenceWeights weights, double minRejectConfidence) {
        this(weights, minRejectConfidence, Clock.systemUTC());
    }

    public VerdictGenerator(ConfidenceWeights weights, double minRejectConfidence, Clock clock) {
        if (minRejectConfidence < 0.0 || minRejectConfidence > 1.0) {
            throw new IllegalArgumentException("minRejectConfidence must be within [0, 1]: " + minRejectConfidence);
        }
        this.weights = weights;
        this.minRejectConfidence = minRejectConfidence;
        this.clock = clock;
    }

    /** Issues the first verdict of a session. */
    public VerdictGenerationResult generateVerdict(String sessionId,
                                                   ConstitutionalViolation violation,
                                                   List<RuleEvaluation> evaluations,
                                                   List<Precedent> precedents,
                                                   String issuedBy) {
        return generateVerdict(sessionId, 1, violation, evaluations, precedents, issuedBy);
    }

    /**
     * Issues verdict number {@code issue} of a session; verdicts regenerated
     * for the same session get distinct ids.
     */
    public VerdictGenerationResult generateVerdict(String sessionId,
                                                   int issue,
                                                   ConstitutionalViolation violation,
                                                   List<RuleEvaluation> evaluations,
                                                   List<Precedent> precedents,
                                                   String issuedBy) {
        if (issue < 1) {
            throw new IllegalArgumentException("verdict issue number must be positive: " + issue);
        }
        long started = System.nanoTime();

        List<RuleEvaluation> applying = evaluations.stream().filter(RuleEvaluation::applies).toList();
        boolean anyViolated = applying.stream().anyMatch(e -> e.status() == RuleConditionStatus.VIOLATED);
        VerdictOutcome tentative = applying.isEmpty()
            ? VerdictOutcome.APPROVED
            : anyViolated ? VerdictOutcome.REJECTED : VerdictOutcome.CONDITIONAL;

        double ruleSignal = ruleSignal(evaluations, applying);
        RuleCategory category = primaryCategory(violation, evaluations);
        Agreement agreement = precedentAgreement(category, violation.severity(), tentative, precedents);
        double evidenceSignal = applying.isEmpty()
            ? EvidenceMatcher.coverage(List.of(), violation.evidence())
            : applying.stream().mapToDouble(RuleEvaluation::evidenceCoverage).average().orElse(0.0);

        double confidence = round(weights.rule() * ruleSignal
            + weights.precedent() * agreement.score()
            + weights.evidence() * evidenceSignal);

        VerdictOutcome outcome = tentative == VerdictOutcome.REJECTED && confidence < minRejectConfidence
            ? VerdictOutcome.CONDITIONAL
            : tentative;

        List<String> applyingIds = applying.stream().map(RuleEvaluation::ruleId).toList();
        List<String> precedentIds = precedents.stream().map(Precedent::id).toList();

        List<ReasoningStep> reasoning = new ArrayList<>();
        reasoning.add(new ReasoningStep(1,
            "Evaluated " + evaluations.size() + " rule(s); " + applying.size() + " apply" + describe(applying),
            List.of(), evaluations.stream().map(RuleEvaluation::ruleId).toList(), round(ruleSignal)));
        reasoning.add(new ReasoningStep(2,
            "Consulted " + precedents.size() + " precedent(s): " + agreement.agreeing() + " agree and "
                + agreement.conflicting() + " conflict with a " + tentative.getValue() + " outcome",
            precedentIds, List.of(), round(agreement.score())));
        reasoning.add(new ReasoningStep(3,
            String.format(Locale.ROOT, "Evidence completeness %.2f over %d supplied item(s)",
                evidenceSignal, violation.evidence().size()),
            violation.evidence(), applyingIds, round(evidenceSignal)));
        reasoning.add(new ReasoningStep(4,
            String.format(Locale.ROOT, "Confidence %.2f x %.4f + %.2f x %.4f + %.2f x %.4f = %.4f",
                weights.rule(), ruleSignal, weights.precedent(), agreement.score(),
                weights.evidence(), evidenceSignal, confidence),
            List.of(), List.of(), confidence));
        reasoning.add(new ReasoningStep(5, outcomeReason(outcome, tentative, confidence),
            List.of(), applyingIds, confidence));

        Verdict verdict = new Verdict(
            "VERDICT-" + sessionId + "-" + issue,
            sessionId,
            outcome,
            reasoning,
            applyingIds,
            violation.evidence(),
            precedentIds,
            conditions(violation, applying, outcome),
            confidence,
            issuedBy,
            clock.instant()
        );
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        log.debug("Verdict {} for session {}: outcome={} confidence={} (r={}, p={}, e={})",
            verdict.id(), sessionId, outcome, confidence, ruleSignal, agreement.score(), evidenceSignal);
        return new VerdictGenerationResult(verdict, elapsedMs);
    }

    private static double ruleSignal(List<RuleEvaluation> evaluations, List<RuleEvaluation> applying) {
        if (!applying.isEmpty()) {
            return applying.stream().mapToDouble(RuleEvaluation::strength).max().orElse(0.0);
        }
        if (evaluations.isEmpty()) {
            return 0.0;
        }
        long satisfied = evaluations.stream().filter(e -> e.status() == RuleConditionStatus.SATISFIED).count();
        return (double) satisfied / evaluations.size();
    }

    private static RuleCategory primaryCategory(ConstitutionalViolation violation, List<RuleEvaluation> evaluations) {
        return evaluations.stream()
            .filter(e -> e.ruleId().equals(violation.ruleId()) && e.category() != null)
            .map(RuleEvaluation::category)
            .findFirst()
            .orElseGet(() -> evaluations.stream()
                .map(RuleEvaluation::category)
                .filter(c -> c != null)
                .findFirst()
                .orElse(null));
    }

    private static Agreement precedentAgreement(RuleCategory category,
                                                ViolationSeverity severity,
                                                VerdictOutcome tentative,
                                                List<Precedent> precedents) {
        int agreeing = 0;
        int conflicting = 0;
        for (Precedent precedent : precedents) {
            if (category == null || precedent.applicability().category() != category) {
                continue;
            }
            ViolationSeverity theirs = precedent.applicability().severity();
            boolean closeSeverity = severity == null || theirs == null || severity.distanceTo(theirs) <= 1;
            if (closeSeverity && precedent.verdict().outcome() == tentative) {
                agreeing++;
            } else {
                conflicting++;
            }
        }
        int considered = agreeing + conflicting;
        double score = considered == 0
            ? NEUTRAL_AGREEMENT
            : NEUTRAL_AGREEMENT + NEUTRAL_AGREEMENT * (agreeing - conflicting) / considered;
        return new Agreement(agreeing, conflicting, score);
    }

    private static List<String> conditions(ConstitutionalViolation violation,
                                           List<RuleEvaluation> applying,
                                           VerdictOutcome outcome) {
        Set<String> conditions = new LinkedHashSet<>();
        for (RuleEvaluation evaluation : applying) {
            evaluation.missingEvidence().forEach(item -> conditions.add("Provide required evidence: " + item));
            if (evaluation.status() == RuleConditionStatus.INDETERMINATE) {
                conditions.add("Supply context to decide rule " + evaluation.ruleId());
            }
        }
        if (outcome != VerdictOutcome.APPROVED && violation.severity() == ViolationSeverity.CRITICAL) {
            conditions.add("Human oversight required for critical violation");
        }
        return List.copyOf(conditions);
    }

    private String outcomeReason(VerdictOutcome outcome, VerdictOutcome tentative, double confidence) {
        if (outcome != tentative) {
            return String.format(Locale.ROOT,
                "Outcome %s: violation found but confidence %.4f is below %.2f",
                outcome.getValue(), confidence, minRejectConfidence);
        }
        return switch (outcome) {
            case REJECTED -> "Outcome rejected: at least one rule is violated";
            case CONDITIONAL -> "Outcome conditional: applying rules cannot be decided from the available context";
            case APPROVED -> "Outcome approved: no rule applies to the reported action";
        };
    }

    private static String describe(List<RuleEvaluation> applying) {
        if (applying.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder(" (");
        for (int i = 0; i < applying.size(); i++) {
            RuleEvaluation evaluation = applying.get(i);
            if (i > 0) {
                text.append(", ");
            }
            text.append(evaluation.ruleId()).append(' ')
                .append(evaluation.status().name().toLowerCase(Locale.ROOT))
                .append(' ').append(evaluation.strength());
        }
        return text.append(')').toString();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private record Agreement(int agreeing, int conflicting, double score) {
    }
}
