package com.arbiter.rules;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The action under evaluation, as seen by the rule engine.
 *
 * @param action      identifier of the action; a violation uses the rule id it was reported against
 * @param actor       participant that performed the action
 * @param parameters  condition inputs (the violation context)
 * @param environment ambient facts, consulted when a key is absent from {@code parameters}
 * @param evidence    evidence references available for the action
 * @param timestamp   when the action happened; decides which rules are in effect
 */
public record ActionContext(
    String action,
    String actor,
    Map<String, Object> parameters,
    Map<String, Object> environment,
    List<String> evidence,
    Instant timestamp
) {

    public ActionContext {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
