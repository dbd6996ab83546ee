package com.arbiter.waiver;

public enum WaiverStatus {
    APPROVED,
    REJECTED,
    EXPIRED,
    REVOKED
}
