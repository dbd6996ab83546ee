package com.arbiter.appeal;

import com.arbiter.verdict.Verdict;

import java.util.Locale;

/**
 * Default assessor.
 *
 * <pre>
 * score = 0.4 x min(1, newEvidence / 4)
 *       + 0.3 x grounds substance (min(1, words / 30))
 *       + 0.3 x (1 - original verdict confidence)
 * </pre>
 * A score of at least 0.6 recommends overturning, at most 0.35 upholding,
 * anything between is remanded.
 */
public class EvidenceWeightedAssessor implements AppealAssessor {

    static final double EVIDENCE_WEIGHT = 0.4;
    static final double GROUNDS_WEIGHT = 0.3;
    static final double DOUBT_WEIGHT = 0.3;
    static final double OVERTURN_AT = 0.6;
    static final double UPHOLD_AT = 0.35;

    private static final int FULL_EVIDENCE = 4;
    private static final int FULL_GROUNDS_WORDS = 30;

    @Override
    public ReviewerVote assess(String reviewerId, Appeal appeal, Verdict verdict) {
        double evidence = Math.min(1.0, (double) appeal.newEvidence().size() / FULL_EVIDENCE);
        int words = appeal.grounds().isBlank() ? 0 : appeal.grounds().trim().split("\\s+").length;
        double grounds = Math.min(1.0, (double) words / FULL_GROUNDS_WORDS);
        double doubt = 1.0 - verdict.confidence();
        double score = EVIDENCE_WEIGHT * evidence + GROUNDS_WEIGHT * grounds + DOUBT_WEIGHT * doubt;

        AppealRecommendation recommendation;
        double confidence;
        if (score >= OVERTURN_AT) {
            recommendation = AppealRecommendation.OVERTURN;
            confidence = score;
        } else if (score <= UPHOLD_AT) {
            recommendation = AppealRecommendation.UPHOLD;
            confidence = 1.0 - score;
        } else {
            recommendation = AppealRecommendation.REMAND;
            confidence = 0.5;
        }
        String rationale = String.format(Locale.ROOT,
            "%d new evidence items, %d words of grounds, original confidence %.2f (score %.2f)",
            appeal.newEvidence().size(), words, verdict.confidence(), score);
        return new ReviewerVote(reviewerId, recommendation, rationale, Math.round(confidence * 10_000.0) / 10_000.0);
    }
}
