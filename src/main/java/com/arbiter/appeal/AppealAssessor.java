package com.arbiter.appeal;

import com.arbiter.verdict.Verdict;

/**
 * Produces a recommendation for a reviewer who has not cast an explicit vote.
 */
@FunctionalInterface
public interface AppealAssessor {

    ReviewerVote assess(String reviewerId, Appeal appeal, Verdict verdict);
}
