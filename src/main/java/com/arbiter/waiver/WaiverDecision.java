package com.arbiter.waiver;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Recorded waiver decision. Revocation, expiry and extension produce new
 * instances; the original stays in the interpreter's history.
 */
public record WaiverDecision(
    String requestId,
    String ruleId,
    WaiverStatus status,
    WaiverOutcome outcome,
    String reasoning,
    List<String> conditions,
    Duration approvedDuration,
    Instant expiresAt,
    Instant autoRevokeAt,
    String decidedBy,
    Instant decidedAt,
    double confidence
) {

    public WaiverDecision {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    WaiverDecision withStatus(WaiverStatus newStatus, String note) {
        return new WaiverDecision(requestId, ruleId, newStatus, outcome,
            note == null ? reasoning : reasoning + "; " + note,
            conditions, approvedDuration, expiresAt, autoRevokeAt, decidedBy, decidedAt, confidence);
    }

    WaiverDecision extendedBy(Duration extension, String note, boolean autoRevoke) {
        Instant newExpiry = expiresAt.plus(extension);
        return new WaiverDecision(requestId, ruleId, status, outcome, reasoning + "; " + note,
            conditions, approvedDuration.plus(extension), newExpiry, autoRevoke ? newExpiry : autoRevokeAt,
            decidedBy, decidedAt, confidence);
    }
}
