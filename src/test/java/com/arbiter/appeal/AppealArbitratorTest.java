package com.arbiter.appeal;

import com.arbiter.ArbitrationFixtures;
import com.arbiter.arbitration.ArbitrationErrorCode;
import com.arbiter.arbitration.ArbitrationException;
import com.arbiter.contract.ContractViolationException;
import com.arbiter.verdict.Verdict;
import com.arbiter.verdict.VerdictOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppealArbitratorTest {

    private static final String GROUNDS = "The linter report attached was produced after the merge";

    private Verdict verdict;

    @BeforeEach
    void setUp() {
        verdict = ArbitrationFixtures.verdict("ARB-1", VerdictOutcome.REJECTED, 0.85, "CODE-001");
    }

    private static AppealArbitrator arbitratorVoting(AppealRecommendation recommendation) {
        return new AppealArbitrator(AppealPolicy.defaults(),
            (reviewerId, appeal, v) -> new ReviewerVote(reviewerId, recommendation, "assessed", 0.9));
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        void submit_recordsOpenAppeal() {
            AppealArbitrator arbitrator = new AppealArbitrator();
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of("new.log"));
            assertEquals("APPEAL-1", appeal.id());
            assertEquals(AppealStatus.SUBMITTED, appeal.status());
            assertEquals("VERDICT-ARB-1", appeal.originalVerdictId());
            assertEquals(List.of(appeal), arbitrator.getAppealsForSession("ARB-1"));
        }

        @Test
        void secondOpenAppealBySameAppellant_rejected() {
            AppealArbitrator arbitrator = new AppealArbitrator();
            arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            ArbitrationException ex = assertThrows(ArbitrationException.class,
                () -> arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of()));
            assertEquals(ArbitrationErrorCode.APPEAL_LIMIT_EXCEEDED, ex.getCode());

            assertDoesNotThrow(() -> arbitrator.submitAppeal("ARB-1", verdict, "agent-8", GROUNDS, List.of()));
        }

        @Test
        void blankGrounds_rejected() {
            AppealArbitrator arbitrator = new AppealArbitrator();
            assertThrows(ContractViolationException.class,
                () -> arbitrator.submitAppeal("ARB-1", verdict, "agent-7", "  ", List.of()));
            assertThrows(ContractViolationException.class,
                () -> arbitrator.submitAppeal("ARB-1", verdict, "", GROUNDS, List.of()));
        }

        @Test
        void missingVerdict_rejected() {
            assertThrows(IllegalArgumentException.class,
                () -> new AppealArbitrator().submitAppeal("ARB-1", null, "agent-7", GROUNDS, List.of()));
        }
    }

    @Nested
    @DisplayName("Review")
    class Review {

        @Test
        void unanimousOverturn_producesReversedVerdict() {
            AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.OVERTURN);
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of("new.log"));

            AppealDecision decision = arbitrator.reviewAppeal(appeal.id(), List.of("r1", "r2"), verdict);

            assertEquals(AppealOutcome.OVERTURNED, decision.decision());
            assertEquals(0.9, decision.confidence());
            assertEquals(2, decision.votes().size());
            Verdict replacement = decision.newVerdict();
            assertEquals("VERDICT-ARB-1-APPEAL-1", replacement.id());
            assertEquals("ARB-1", replacement.sessionId());
            assertEquals(VerdictOutcome.APPROVED, replacement.outcome());
            assertEquals(List.of("linter_report.txt", "new.log"), replacement.evidence());
            assertEquals(verdict.reasoning().size() + 1, replacement.reasoning().size());
            assertTrue(replacement.conditions().isEmpty());
            assertEquals(0.9, replacement.confidence());
            assertEquals(AppealArbitrator.PANEL_ISSUER, replacement.issuedBy());
            assertEquals(AppealStatus.OVERTURNED, arbitrator.getAppeal(appeal.id()).orElseThrow().status());
            assertEquals(decision, arbitrator.getDecision(appeal.id()).orElseThrow());
        }

        @Test
        void unanimousUphold_keepsVerdict() {
            AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.UPHOLD);
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            AppealDecision decision = arbitrator.reviewAppeal(appeal.id(), List.of("r1"), verdict);
            assertEquals(AppealOutcome.UPHELD, decision.decision());
            assertNull(decision.newVerdict());
            assertFalse(decision.isOverturned());
        }

        @Test
        void majorityAtThreshold_decides() {
            AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.UPHOLD);
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            arbitrator.castVote(appeal.id(), "r1", AppealRecommendation.OVERTURN, "evidence is new");
            Appeal underReview = arbitrator.castVote(appeal.id(), "r2", AppealRecommendation.OVERTURN, "agreed");
            assertEquals(AppealStatus.UNDER_REVIEW, underReview.status());

            AppealDecision decision = arbitrator.reviewAppeal(appeal.id(), List.of("r1", "r2", "r3"), verdict);

            assertEquals(AppealOutcome.OVERTURNED, decision.decision());
            assertEquals(0.6667, decision.confidence());
        }

        @Test
        void splitBelowThreshold_remandsAndStaysOpen() {
            AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.UPHOLD);
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            arbitrator.castVote(appeal.id(), "r1", AppealRecommendation.OVERTURN, "evidence is new");

            AppealDecision remand = arbitrator.reviewAppeal(appeal.id(), List.of("r1", "r2"), verdict);

            assertEquals(AppealOutcome.REMANDED, remand.decision());
            assertTrue(arbitrator.getAppeal(appeal.id()).orElseThrow().status().isOpen());
            assertTrue(arbitrator.getDecision(appeal.id()).isEmpty());

            // cast votes are cleared by the remand, so the assessor now decides alone
            AppealDecision second = arbitrator.reviewAppeal(appeal.id(), List.of("r1", "r2"), verdict);
            assertEquals(AppealOutcome.UPHELD, second.decision());
        }

        @Test
        void decidedAppeal_cannotBeReviewedAgain() {
            AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.UPHOLD);
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            arbitrator.reviewAppeal(appeal.id(), List.of("r1"), verdict);

            ArbitrationException ex = assertThrows(ArbitrationException.class,
                () -> arbitrator.reviewAppeal(appeal.id(), List.of("r1"), verdict));
            assertEquals(ArbitrationErrorCode.APPEAL_ALREADY_DECIDED, ex.getCode());
            ArbitrationException vote = assertThrows(ArbitrationException.class,
                () -> arbitrator.castVote(appeal.id(), "r1", AppealRecommendation.OVERTURN, "late"));
            assertEquals(ArbitrationErrorCode.APPEAL_ALREADY_DECIDED, vote.getCode());
        }

        @Test
        void unknownAppeal_notFound() {
            ArbitrationException ex = assertThrows(ArbitrationException.class,
                () -> new AppealArbitrator().reviewAppeal("APPEAL-404", List.of("r1"), verdict));
            assertEquals(ArbitrationErrorCode.APPEAL_NOT_FOUND, ex.getCode());
        }

        @Test
        void emptyPanel_rejected() {
            AppealArbitrator arbitrator = new AppealArbitrator();
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            assertThrows(IllegalArgumentException.class,
                () -> arbitrator.reviewAppeal(appeal.id(), List.of(), verdict));
        }

        @Test
        void verdictOfOtherSession_rejected() {
            AppealArbitrator arbitrator = new AppealArbitrator();
            Appeal appeal = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
            Verdict other = ArbitrationFixtures.verdict("ARB-2", VerdictOutcome.REJECTED, 0.85, "CODE-001");
            assertThrows(IllegalArgumentException.class,
                () -> arbitrator.reviewAppeal(appeal.id(), List.of("r1"), other));
        }
    }

    @Test
    void statistics_countOutcomes() {
        AppealArbitrator arbitrator = arbitratorVoting(AppealRecommendation.OVERTURN);
        Appeal first = arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());
        arbitrator.reviewAppeal(first.id(), List.of("r1"), verdict);
        arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of());

        AppealStatistics stats = arbitrator.getStatistics();
        assertEquals(2, stats.totalAppeals());
        assertEquals(1, stats.openAppeals());
        assertEquals(1, stats.overturnedCount());
        assertEquals(1.0, stats.overturnRate());

        arbitrator.clear();
        assertEquals(0, arbitrator.getStatistics().totalAppeals());
        assertEquals("APPEAL-1", arbitrator.submitAppeal("ARB-1", verdict, "agent-7", GROUNDS, List.of()).id());
    }

    @Nested
    @DisplayName("Evidence weighted assessor")
    class Assessor {

        private final EvidenceWeightedAssessor assessor = new EvidenceWeightedAssessor();

        private Appeal appeal(String grounds, List<String> evidence) {
            return new Appeal("APPEAL-1", "ARB-1", verdict.id(), "agent-7", grounds, evidence, null,
                AppealStatus.SUBMITTED);
        }

        @Test
        void strongAppeal_recommendsOverturn() {
            String grounds = String.join(" ", Collections.nCopies(30, "word"));
            Verdict doubtful = ArbitrationFixtures.verdict("ARB-1", VerdictOutcome.REJECTED, 0.4, "CODE-001");
            ReviewerVote vote = assessor.assess("r1", appeal(grounds, List.of("a", "b", "c", "d")), doubtful);
            assertEquals(AppealRecommendation.OVERTURN, vote.recommendation());
            assertEquals(0.88, vote.confidence());
        }

        @Test
        void weakAppeal_recommendsUphold() {
            Verdict firm = ArbitrationFixtures.verdict("ARB-1", VerdictOutcome.REJECTED, 0.95, "CODE-001");
            ReviewerVote vote = assessor.assess("r1", appeal("wrong", List.of()), firm);
            assertEquals(AppealRecommendation.UPHOLD, vote.recommendation());
        }

        @Test
        void middlingAppeal_recommendsRemand() {
            String grounds = String.join(" ", Collections.nCopies(15, "word"));
            Verdict firm = ArbitrationFixtures.verdict("ARB-1", VerdictOutcome.REJECTED, 0.9, "CODE-001");
            ReviewerVote vote = assessor.assess("r1", appeal(grounds, List.of("a", "b")), firm);
            assertEquals(AppealRecommendation.REMAND, vote.recommendation());
            assertEquals(0.5, vote.confidence());
        }
    }
}
