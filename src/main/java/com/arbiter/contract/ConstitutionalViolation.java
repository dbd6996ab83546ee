package com.arbiter.contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A rule violation reported by the detection collaborator. Immutable; the
 * context map is handed to rule evaluation as-is.
 */
public record ConstitutionalViolation(
    String id,
    String ruleId,
    String violator,
    ViolationSeverity severity,
    String description,
    Map<String, Object> context,
    Instant detectedAt,
    List<String> evidence
) {

    public static final String UNKNOWN_VIOLATOR = "unknown";

    public ConstitutionalViolation {
        violator = violator == null || violator.isBlank() ? UNKNOWN_VIOLATOR : violator;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
