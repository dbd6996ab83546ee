package com.arbiter.precedent;

import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;

import java.util.Map;

public record PrecedentStatistics(
    long totalPrecedents,
    Map<RuleCategory, Long> byCategory,
    Map<ViolationSeverity, Long> bySeverity,
    long totalCitations
) {

    public PrecedentStatistics {
        byCategory = byCategory == null ? Map.of() : Map.copyOf(byCategory);
        bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
    }
}
