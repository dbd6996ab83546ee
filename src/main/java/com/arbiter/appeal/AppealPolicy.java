package com.arbiter.appeal;

/**
 * @param maxActiveAppealsPerAppellant open appeals one appellant may hold per session
 * @param majorityThreshold            fraction of reviewers a split decision needs, in (0.5, 1]
 */
public record AppealPolicy(
    int maxActiveAppealsPerAppellant,
    double majorityThreshold,
    int minReviewers
) {

    public AppealPolicy {
        if (maxActiveAppealsPerAppellant < 1) {
            throw new IllegalArgumentException("maxActiveAppealsPerAppellant must be at least 1");
        }
        if (majorityThreshold <= 0.5 || majorityThreshold > 1.0) {
            throw new IllegalArgumentException("majorityThreshold must be within (0.5, 1]: " + majorityThreshold);
        }
        if (minReviewers < 1) {
            throw new IllegalArgumentException("minReviewers must be at least 1");
        }
    }

    public static AppealPolicy defaults() {
        return new AppealPolicy(1, 2.0 / 3.0, 1);
    }
}
