package com.arbiter.precedent;

import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;

import java.util.List;

/** Which future cases a precedent speaks to. */
public record PrecedentApplicability(
    RuleCategory category,
    ViolationSeverity severity,
    List<String> conditions
) {

    public PrecedentApplicability {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
