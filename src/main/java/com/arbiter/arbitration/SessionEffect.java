package com.arbiter.arbitration;

import com.arbiter.precedent.PrecedentApplicability;
import com.arbiter.verdict.Verdict;

import java.util.List;

/**
 * Side effect a phase asks the orchestrator to apply.
 */
public sealed interface SessionEffect {

    record CreatePrecedent(
        Verdict verdict,
        String title,
        List<String> keyFacts,
        String reasoningSummary,
        PrecedentApplicability applicability
    ) implements SessionEffect {
        public CreatePrecedent {
            keyFacts = List.copyOf(keyFacts);
        }
    }

    record ReplaceVerdict(Verdict newVerdict, String appealId) implements SessionEffect {}
}
