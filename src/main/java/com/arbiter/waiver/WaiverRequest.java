package com.arbiter.waiver;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param requestedDuration how long the waiver should last; null means the policy default
 */
public record WaiverRequest(
    String id,
    String ruleId,
    String requestedBy,
    String justification,
    List<String> evidence,
    Duration requestedDuration,
    Instant requestedAt,
    Map<String, Object> context
) {

    public WaiverRequest {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        requestedAt = requestedAt == null ? Instant.now() : requestedAt;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
