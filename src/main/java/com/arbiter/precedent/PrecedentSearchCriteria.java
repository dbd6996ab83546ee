package com.arbiter.precedent;

import com.arbiter.contract.RuleCategory;
import com.arbiter.contract.ViolationSeverity;

import java.util.Set;

/**
 * Exact-match filters for browsing precedents. Empty sets and a null
 * keyword match everything.
 */
public record PrecedentSearchCriteria(
    Set<RuleCategory> categories,
    Set<ViolationSeverity> severities,
    Set<String> ruleIds,
    String keyword,
    int limit
) {

    public static final int DEFAULT_LIMIT = 100;

    public PrecedentSearchCriteria {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        severities = severities == null ? Set.of() : Set.copyOf(severities);
        ruleIds = ruleIds == null ? Set.of() : Set.copyOf(ruleIds);
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static PrecedentSearchCriteria all() {
        return new PrecedentSearchCriteria(Set.of(), Set.of(), Set.of(), null, DEFAULT_LIMIT);
    }

    public static PrecedentSearchCriteria byCategory(RuleCategory... categories) {
        return new PrecedentSearchCriteria(Set.of(categories), Set.of(), Set.of(), null, DEFAULT_LIMIT);
    }
}
