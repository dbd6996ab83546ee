package com.arbiter.appeal;

public record AppealStatistics(
    long totalAppeals,
    long openAppeals,
    long upheldCount,
    long overturnedCount,
    long remandedCount,
    double overturnRate
) {
}
