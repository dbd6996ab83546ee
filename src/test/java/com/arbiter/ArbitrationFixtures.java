package com.arbiter;

import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.contract.ConstitutionalViolation;
import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;
import com.arbiter.verdict.ReasoningStep;
import com.arbiter.verdict.Verdict;
import com.arbiter.verdict.VerdictOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Builders shared by the unit and integration tests. */
public final class ArbitrationFixtures {

    public static final Instant EPOCH_2024 = Instant.parse("2024-01-01T00:00:00Z");

    private ArbitrationFixtures() {
    }

    public static ConstitutionalRule rule(String id, RuleCategory category, String condition,
                                          ViolationSeverity severity, String... requiredEvidence) {
        return new ConstitutionalRule(id, "1.0", category, id + " title", id + " description", condition,
            severity, true, List.of(requiredEvidence), EPOCH_2024, null, Map.of());
    }

    public static ConstitutionalRule lintRule() {
        return rule("CODE-001", RuleCategory.CODE_QUALITY, "linted === true", ViolationSeverity.MEDIUM,
            "linter_report");
    }

    public static ConstitutionalRule testRule() {
        return rule("TEST-001", RuleCategory.TESTING, "coverage >= 80", ViolationSeverity.MEDIUM,
            "coverage_report");
    }

    public static ConstitutionalViolation violation(String ruleId, ViolationSeverity severity,
                                                    String description, Map<String, Object> context,
                                                    List<String> evidence) {
        return new ConstitutionalViolation("VIO-" + ruleId, ruleId, "agent-7", severity, description,
            context, Instant.now(), evidence);
    }

    /** Unlinted code with a linter report attached: the lint rule applies at full strength. */
    public static ConstitutionalViolation lintViolation() {
        return violation("CODE-001", ViolationSeverity.MEDIUM, "Merged code without running the linter",
            Map.of("linted", false, "coverage", 85), List.of("linter_report.txt"));
    }

    public static Verdict verdict(String sessionId, VerdictOutcome outcome, double confidence, String... rules) {
        return new Verdict("VERDICT-" + sessionId, sessionId, outcome,
            List.of(new ReasoningStep(1, "Rule checked", List.of(), List.of(rules), confidence)),
            List.of(rules), List.of("linter_report.txt"), List.of(), List.of(), confidence, "arbiter-1",
            Instant.now());
    }
}
