package com.arbiter.appeal;

import java.time.Instant;
import java.util.List;

/**
 * Request to re-examine a session's verdict. Status changes produce a new
 * instance held by the arbitrator.
 */
public record Appeal(
    String id,
    String sessionId,
    String originalVerdictId,
    String appellantId,
    String grounds,
    List<String> newEvidence,
    Instant submittedAt,
    AppealStatus status
) {

    public Appeal {
        newEvidence = newEvidence == null ? List.of() : List.copyOf(newEvidence);
    }

    Appeal withStatus(AppealStatus newStatus) {
        return new Appeal(id, sessionId, originalVerdictId, appellantId, grounds, newEvidence, submittedAt, newStatus);
    }
}
