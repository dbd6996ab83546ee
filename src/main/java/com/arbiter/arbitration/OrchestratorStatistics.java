package com.arbiter.arbitration;

public record OrchestratorStatistics(
    long totalSessions,
    long activeSessions,
    long completedSessions,
    long failedSessions,
    double averageDurationMs,
    long totalPrecedents,
    long totalAppeals,
    long totalWaivers
) {
}
