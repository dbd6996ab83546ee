package com.arbiter.waiver;

public record WaiverStatistics(
    long totalWaivers,
    long approvedCount,
    long rejectedCount,
    long revokedCount,
    long expiredCount,
    long activeCount,
    double averageDurationMs
) {
}
