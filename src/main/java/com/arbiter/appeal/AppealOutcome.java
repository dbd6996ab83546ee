package com.arbiter.appeal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AppealOutcome {
    UPHELD,
    OVERTURNED,
    REMANDED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    AppealStatus toStatus() {
        return switch (this) {
            case UPHELD -> AppealStatus.UPHELD;
            case OVERTURNED -> AppealStatus.OVERTURNED;
            case REMANDED -> AppealStatus.REMANDED;
        };
    }
}
