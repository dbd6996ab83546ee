package com.arbiter.arbitration;

import com.arbiter.appeal.AppealDecision;
import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.precedent.PrecedentApplicability;
import com.arbiter.verdict.Verdict;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides the side effects of the verdict and appeal phases. Pure: the
 * orchestrator applies what these methods return.
 */
final class ArbitrationPhases {

    private ArbitrationPhases() {
    }

    /** A verdict becomes a precedent only when its confidence is strictly above the threshold. */
    static List<SessionEffect> verdictEffects(ArbitrationSession session, Verdict verdict, double threshold) {
        if (verdict.confidence() <= threshold) {
            return List.of();
        }
        ConstitutionalRule rule = session.getPrimaryRule();
        return List.of(new SessionEffect.CreatePrecedent(
            verdict,
            session.getViolation().ruleId() + " Violation",
            List.of(session.getViolation().description()),
            verdict.reasoningSummary(),
            new PrecedentApplicability(rule.category(), session.getViolation().severity(), verdict.conditions())
        ));
    }

    /**
     * An overturn replaces the verdict and records the replacement as a
     * precedent whose key facts combine the description with all evidence.
     */
    static List<SessionEffect> appealEffects(ArbitrationSession session, AppealDecision decision) {
        if (!decision.isOverturned()) {
            return List.of();
        }
        Verdict replacement = decision.newVerdict();
        ConstitutionalRule rule = session.getPrimaryRule();
        List<String> keyFacts = new ArrayList<>();
        keyFacts.add(session.getViolation().description());
        keyFacts.addAll(replacement.evidence());
        return List.of(
            new SessionEffect.ReplaceVerdict(replacement, decision.appealId()),
            new SessionEffect.CreatePrecedent(
                replacement,
                session.getViolation().ruleId() + " Appeal Overturn",
                keyFacts,
                decision.reasoning(),
                new PrecedentApplicability(rule.category(), session.getViolation().severity(), List.of())
            )
        );
    }
}
