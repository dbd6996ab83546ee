package com.arbiter.appeal;

import com.arbiter.arbitration.ArbitrationErrorCode;
import com.arbiter.arbitration.ArbitrationException;
import com.arbiter.contract.ContractViolationException;
import com.arbiter.verdict.ReasoningStep;
import com.arbiter.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records appeals and aggregates reviewer votes into a decision.
 *
 * Each named reviewer contributes one vote: the vote cast through
 * {@link #castVote}, or else the {@link AppealAssessor}'s recommendation.
 * A unanimous panel decides outright. A split panel decides by majority when
 * the majority fraction reaches the configured threshold, with that fraction
 * as confidence; otherwise the appeal is remanded and stays open.
 */
public class AppealArbitrator {

    private static final Logger log = LoggerFactory.getLogger(AppealArbitrator.class);

    public static final String PANEL_ISSUER = "appeal-panel";

    private final AppealPolicy policy;
    private final AppealAssessor assessor;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, Appeal> appeals = new LinkedHashMap<>();
    private final Map<String, Map<String, ReviewerVote>> castVotes = new LinkedHashMap<>();
    private final Map<String, AppealDecision> decisions = new LinkedHashMap<>();

    public AppealArbitrator() {
        this(AppealPolicy.defaults(), new EvidenceWeightedAssessor());
    }

    public AppealArbitrator(AppealPolicy policy, AppealAssessor assessor) {
        this(policy, assessor, Clock.systemUTC());
    }

    public AppealArbitrator(AppealPolicy policy, AppealAssessor assessor, Clock clock) {
        this.policy = policy;
        this.assessor = assessor;
        this.clock = clock;
    }

    public AppealPolicy getPolicy() {
        return policy;
    }

    /**
     * Records an appeal against the session's verdict.
     *
     * @throws ContractViolationException when the grounds are blank
     * @throws ArbitrationException       APPEAL_LIMIT_EXCEEDED when the appellant already
     *                                    holds the maximum number of open appeals on the session
     */
    public synchronized Appeal submitAppeal(String sessionId,
                                            Verdict verdict,
                                            String appellantId,
                                            String grounds,
                                            List<String> newEvidence) {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required to submit an appeal");
        }
        if (appellantId == null || appellantId.isBlank()) {
            throw new ContractViolationException("appellantId is required");
        }
        if (grounds == null || grounds.isBlank()) {
            throw new ContractViolationException("appeal grounds are required");
        }
        long open = appeals.values().stream()
            .filter(a -> a.sessionId().equals(sessionId))
            .filter(a -> a.appellantId().equals(appellantId))
            .filter(a -> a.status().isOpen())
            .count();
        if (open >= policy.maxActiveAppealsPerAppellant()) {
            throw new ArbitrationException(ArbitrationErrorCode.APPEAL_LIMIT_EXCEEDED,
                "Appellant " + appellantId + " already has " + open + " active appeal(s) on session " + sessionId,
                sessionId);
        }

        Appeal appeal = new Appeal("APPEAL-" + sequence.incrementAndGet(), sessionId, verdict.id(),
            appellantId, grounds.trim(), newEvidence, clock.instant(), AppealStatus.SUBMITTED);
        appeals.put(appeal.id(), appeal);
        log.info("Appeal {} submitted by {} against verdict {} (newEvidence={})",
            appeal.id(), appellantId, verdict.id(), appeal.newEvidence().size());
        return appeal;
    }

    /** Records a reviewer's explicit vote. A later vote by the same reviewer replaces the earlier one. */
    public synchronized Appeal castVote(String appealId,
                                        String reviewerId,
                                        AppealRecommendation recommendation,
                                        String rationale) {
        Appeal appeal = requireOpen(appealId);
        castVotes.computeIfAbsent(appealId, id -> new LinkedHashMap<>())
            .put(reviewerId, new ReviewerVote(reviewerId, recommendation, rationale, 1.0));
        Appeal underReview = appeal.withStatus(AppealStatus.UNDER_REVIEW);
        appeals.put(appealId, underReview);
        log.debug("Reviewer {} voted {} on appeal {}", reviewerId, recommendation, appealId);
        return underReview;
    }

    /**
     * Aggregates the panel's votes into a decision. An overturn carries the
     * replacement verdict: outcome reversed, evidence merged, confidence equal
     * to the decision's confidence.
     */
    public synchronized AppealDecision reviewAppeal(String appealId, List<String> reviewers, Verdict verdict) {
        Appeal appeal = requireOpen(appealId);
        List<String> panel = reviewers == null ? List.of() : List.copyOf(new LinkedHashSet<>(reviewers));
        if (panel.size() < policy.minReviewers()) {
            throw new IllegalArgumentException("appeal review needs at least " + policy.minReviewers()
                + " reviewer(s), got " + panel.size());
        }
        if (verdict == null || !appeal.sessionId().equals(verdict.sessionId())) {
            throw new IllegalArgumentException("verdict does not belong to the appealed session");
        }

        Map<String, ReviewerVote> cast = castVotes.getOrDefault(appealId, Map.of());
        List<ReviewerVote> votes = new ArrayList<>(panel.size());
        for (String reviewerId : panel) {
            ReviewerVote vote = cast.get(reviewerId);
            votes.add(vote != null ? vote : assessor.assess(reviewerId, appeal, verdict));
        }

        Map<AppealRecommendation, Integer> tally = new EnumMap<>(AppealRecommendation.class);
        votes.forEach(v -> tally.merge(v.recommendation(), 1, Integer::sum));
        Map.Entry<AppealRecommendation, Integer> top = tally.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .orElseThrow();
        double fraction = (double) top.getValue() / votes.size();

        AppealOutcome outcome;
        double confidence;
        String reasoning;
        if (tally.size() == 1) {
            outcome = top.getKey().toOutcome();
            confidence = votes.stream().mapToDouble(ReviewerVote::confidence).average().orElse(1.0);
            reasoning = "Unanimous panel of " + votes.size() + " recommends " + top.getKey();
        } else if (fraction >= policy.majorityThreshold()) {
            outcome = top.getKey().toOutcome();
            confidence = fraction;
            reasoning = "Majority " + top.getValue() + "/" + votes.size() + " recommends " + top.getKey();
        } else {
            outcome = AppealOutcome.REMANDED;
            confidence = fraction;
            reasoning = "Split panel " + tally + " below majority threshold; remanded for further review";
        }
        confidence = round(confidence);

        Instant now = clock.instant();
        Verdict replacement = outcome == AppealOutcome.OVERTURNED
            ? overturnedVerdict(appeal, verdict, reasoning, confidence, now)
            : null;
        AppealDecision decision = new AppealDecision(appealId, outcome, reasoning, confidence, votes, replacement, now);

        appeals.put(appealId, appeal.withStatus(outcome.toStatus()));
        if (outcome == AppealOutcome.REMANDED) {
            castVotes.remove(appealId);
        } else {
            decisions.put(appealId, decision);
        }
        log.info("Appeal {} decided {} (confidence={}, votes={})", appealId, outcome, confidence, tally);
        return decision;
    }

    private Verdict overturnedVerdict(Appeal appeal, Verdict original, String panelReasoning,
                                      double confidence, Instant now) {
        List<ReasoningStep> reasoning = new ArrayList<>(original.reasoning());
        reasoning.add(new ReasoningStep(reasoning.size() + 1,
            "Appeal " + appeal.id() + " overturned verdict " + original.id() + ": " + panelReasoning,
            appeal.newEvidence(), original.rulesApplied(), confidence));
        LinkedHashSet<String> evidence = new LinkedHashSet<>(original.evidence());
        evidence.addAll(appeal.newEvidence());
        return new Verdict(
            original.id() + "-" + appeal.id(),
            original.sessionId(),
            original.outcome().reversed(),
            reasoning,
            original.rulesApplied(),
            List.copyOf(evidence),
            original.precedents(),
            List.of(),
            confidence,
            PANEL_ISSUER,
            now
        );
    }

    public synchronized Optional<Appeal> getAppeal(String appealId) {
        return Optional.ofNullable(appeals.get(appealId));
    }

    public synchronized Optional<AppealDecision> getDecision(String appealId) {
        return Optional.ofNullable(decisions.get(appealId));
    }

    public synchronized List<Appeal> getAppealsForSession(String sessionId) {
        return appeals.values().stream().filter(a -> a.sessionId().equals(sessionId)).toList();
    }

    public synchronized AppealStatistics getStatistics() {
        long open = 0;
        long upheld = 0;
        long overturned = 0;
        long remanded = 0;
        for (Appeal appeal : appeals.values()) {
            switch (appeal.status()) {
                case UPHELD -> upheld++;
                case OVERTURNED -> overturned++;
                case REMANDED -> {
                    remanded++;
                    open++;
                }
                case SUBMITTED, UNDER_REVIEW -> open++;
            }
        }
        long decided = upheld + overturned;
        return new AppealStatistics(appeals.size(), open, upheld, overturned, remanded,
            decided == 0 ? 0.0 : round((double) overturned / decided));
    }

    public synchronized void clear() {
        appeals.clear();
        castVotes.clear();
        decisions.clear();
        sequence.set(0);
    }

    private Appeal requireOpen(String appealId) {
        Appeal appeal = appeals.get(appealId);
        if (appeal == null) {
            throw new ArbitrationException(ArbitrationErrorCode.APPEAL_NOT_FOUND, "Appeal " + appealId + " not found");
        }
        if (!appeal.status().isOpen()) {
            throw new ArbitrationException(ArbitrationErrorCode.APPEAL_ALREADY_DECIDED,
                "Appeal " + appealId + " was already decided: " + appeal.status(), appeal.sessionId());
        }
        return appeal;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
