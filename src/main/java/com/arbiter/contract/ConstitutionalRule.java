package com.arbiter.contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable rule reference data. {@code condition} describes the compliant
 * state of an action, e.g. {@code linted === true && coverage >= 80}.
 */
public record ConstitutionalRule(
    String id,
    String version,
    RuleCategory category,
    String title,
    String description,
    String condition,
    ViolationSeverity severity,
    boolean waivable,
    List<String> requiredEvidence,
    Instant effectiveDate,
    Instant expirationDate,
    Map<String, Object> metadata
) {

    public ConstitutionalRule {
        requiredEvidence = requiredEvidence == null ? List.of() : List.copyOf(requiredEvidence);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Whether the rule is in force at {@code at}; a missing effective date means always. */
    public boolean isInEffectAt(Instant at) {
        if (effectiveDate != null && at.isBefore(effectiveDate)) {
            return false;
        }
        return expirationDate == null || at.isBefore(expirationDate);
    }
}
