package com.arbiter.appeal;

public enum AppealStatus {
    SUBMITTED,
    UNDER_REVIEW,
    /** Sent back for further review; the appeal stays open. */
    REMANDED,
    UPHELD,
    OVERTURNED;

    public boolean isOpen() {
        return this == SUBMITTED || this == UNDER_REVIEW || this == REMANDED;
    }
}
