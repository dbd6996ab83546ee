package com.arbiter.verdict;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerdictOutcome {
    /** No rule violation is upheld; the action stands. */
    APPROVED,
    /** The violation is upheld. */
    REJECTED,
    /** The violation is upheld only partially or pending the attached conditions. */
    CONDITIONAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The outcome an overturning appeal substitutes for this one. */
    public VerdictOutcome reversed() {
        return switch (this) {
            case APPROVED -> REJECTED;
            case REJECTED, CONDITIONAL -> APPROVED;
        };
    }
}
