package com.arbiter.verdict;

import java.util.List;

public record ReasoningStep(
    int step,
    String description,
    List<String> evidence,
    List<String> ruleReferences,
    double confidence
) {

    public ReasoningStep {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        ruleReferences = ruleReferences == null ? List.of() : List.copyOf(ruleReferences);
    }
}
