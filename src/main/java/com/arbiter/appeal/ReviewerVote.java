package com.arbiter.appeal;

/**
 * @param confidence the reviewer's confidence in the recommendation, in [0, 1]
 */
public record ReviewerVote(
    String reviewerId,
    AppealRecommendation recommendation,
    String rationale,
    double confidence
) {

    public ReviewerVote {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("reviewerId is required");
        }
        if (recommendation == null) {
            throw new IllegalArgumentException("recommendation is required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }
}
