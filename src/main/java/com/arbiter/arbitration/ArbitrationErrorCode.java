package com.arbiter.arbitration;

public enum ArbitrationErrorCode {
    SESSION_LIMIT_EXCEEDED,
    SESSION_NOT_FOUND,
    SESSION_TIMEOUT,
    INVALID_STATE,
    INVALID_STATE_TRANSITION,
    WAIVERS_DISABLED,
    APPEALS_DISABLED,
    NO_VERDICT,
    APPEAL_NOT_FOUND,
    APPEAL_LIMIT_EXCEEDED,
    APPEAL_ALREADY_DECIDED
}
