package com.arbiter.appeal;

/** A single reviewer's position on an appeal. */
public enum AppealRecommendation {
    UPHOLD,
    OVERTURN,
    REMAND;

    AppealOutcome toOutcome() {
        return switch (this) {
            case UPHOLD -> AppealOutcome.UPHELD;
            case OVERTURN -> AppealOutcome.OVERTURNED;
            case REMAND -> AppealOutcome.REMANDED;
        };
    }
}
