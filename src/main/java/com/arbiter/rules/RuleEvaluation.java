package com.arbiter.rules;

import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;

import java.util.List;

/**
 * Result of evaluating one rule against one action.
 *
 * @param strength         how strongly the rule applies, in [0, 1]
 * @param evidenceCoverage fraction of the rule's required evidence present, in [0, 1]
 */
public record RuleEvaluation(
    String ruleId,
    RuleCategory category,
    ViolationSeverity severity,
    RuleConditionStatus status,
    double strength,
    double evidenceCoverage,
    List<String> missingEvidence,
    boolean directReference,
    String explanation
) {

    public RuleEvaluation {
        missingEvidence = missingEvidence == null ? List.of() : List.copyOf(missingEvidence);
    }

    public static RuleEvaluation notApplicable(String ruleId, RuleCategory category,
                                               ViolationSeverity severity, String explanation) {
        return new RuleEvaluation(ruleId, category, severity, RuleConditionStatus.NOT_APPLICABLE,
            0.0, 0.0, List.of(), false, explanation);
    }

    public boolean applies() {
        return strength > 0.0
            && (status == RuleConditionStatus.VIOLATED || status == RuleConditionStatus.INDETERMINATE);
    }
}
