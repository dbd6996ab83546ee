package com.arbiter.arbitration;

import com.arbiter.appeal.AppealDecision;
import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.contract.ConstitutionalViolation;
import com.arbiter.precedent.Precedent;
import com.arbiter.rules.RuleEvaluation;
import com.arbiter.verdict.Verdict;
import com.arbiter.waiver.WaiverDecision;
import com.arbiter.waiver.WaiverRequest;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The unit of work of the arbitration protocol.
 *
 * Only the orchestrator mutates a session, and only while holding the
 * session's lock, so lifecycle operations on one session never interleave.
 * Readers see a consistent value per field; the history list is safe to read
 * at any time.
 *
 * {@code endTime} is set exactly while the state is COMPLETED or FAILED. A
 * completed session reopened for appeal keeps its first completion time in
 * {@link #getFirstCompletedAt()} and gets a new {@code endTime} when it
 * completes again.
 */
public class ArbitrationSession {

    private final String id;
    private final ConstitutionalViolation violation;
    private final List<ConstitutionalRule> rulesEvaluated;
    private final List<String> evidence;
    private final List<String> participants;
    private final Instant startTime;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<SessionRecord> history = new CopyOnWriteArrayList<>();

    private volatile ArbitrationState state = ArbitrationState.INITIALIZED;
    private volatile List<Precedent> precedents = List.of();
    private volatile Verdict verdict;
    private volatile WaiverRequest waiverRequest;
    private volatile WaiverDecision waiverDecision;
    private volatile Instant endTime;
    private volatile Instant firstCompletedAt;
    private volatile Instant reopenedAt;

    ArbitrationSession(String id,
                       ConstitutionalViolation violation,
                       List<ConstitutionalRule> rulesEvaluated,
                       List<String> participants,
                       Instant startTime) {
        this.id = id;
        this.violation = violation;
        this.rulesEvaluated = List.copyOf(rulesEvaluated);
        this.evidence = violation.evidence();
        this.participants = List.copyOf(participants);
        this.startTime = startTime;
    }

    public String getId() {
        return id;
    }

    public ArbitrationState getState() {
        return state;
    }

    public ConstitutionalViolation getViolation() {
        return violation;
    }

    public List<ConstitutionalRule> getRulesEvaluated() {
        return rulesEvaluated;
    }

    /** First candidate rule; it decides precedent category and waiver scope. */
    public ConstitutionalRule getPrimaryRule() {
        return rulesEvaluated.get(0);
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public List<String> getParticipants() {
        return participants;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Instant> getFirstCompletedAt() {
        return Optional.ofNullable(firstCompletedAt);
    }

    public Optional<Instant> getReopenedAt() {
        return Optional.ofNullable(reopenedAt);
    }

    public List<Precedent> getPrecedents() {
        return precedents;
    }

    public Optional<Verdict> getVerdict() {
        return Optional.ofNullable(verdict);
    }

    public Optional<WaiverRequest> getWaiverRequest() {
        return Optional.ofNullable(waiverRequest);
    }

    public Optional<WaiverDecision> getWaiverDecision() {
        return Optional.ofNullable(waiverDecision);
    }

    /** Append-only audit history, oldest first. */
    public List<SessionRecord> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Number of verdicts generated for this session so far. */
    public int getVerdictsIssued() {
        return recordsOf(SessionRecord.VerdictIssued.class).size();
    }

    public List<SessionRecord.StateTransition> getStateTransitions() {
        return recordsOf(SessionRecord.StateTransition.class);
    }

    public List<RuleEvaluation> getRuleEvaluationResults() {
        List<SessionRecord.RulesEvaluated> evaluated = recordsOf(SessionRecord.RulesEvaluated.class);
        return evaluated.isEmpty() ? List.of() : evaluated.get(evaluated.size() - 1).results();
    }

    public List<AppealDecision> getAppealDecisions() {
        return recordsOf(SessionRecord.AppealDecided.class).stream()
            .map(SessionRecord.AppealDecided::decision)
            .toList();
    }

    public Optional<AppealDecision> getLatestAppealDecision() {
        List<AppealDecision> decisions = getAppealDecisions();
        return decisions.isEmpty() ? Optional.empty() : Optional.of(decisions.get(decisions.size() - 1));
    }

    /** Verdicts replaced by overturning appeals, oldest first. */
    public List<Verdict> getSupersededVerdicts() {
        return recordsOf(SessionRecord.VerdictSuperseded.class).stream()
            .map(SessionRecord.VerdictSuperseded::previous)
            .toList();
    }

    public Optional<SessionRecord.ErrorDetail> getError() {
        List<SessionRecord.SessionFailed> failures = recordsOf(SessionRecord.SessionFailed.class);
        return failures.isEmpty() ? Optional.empty() : Optional.of(failures.get(failures.size() - 1).error());
    }

    public List<SessionRecord.Annotation> getAnnotations() {
        return recordsOf(SessionRecord.Annotation.class);
    }

    private <T extends SessionRecord> List<T> recordsOf(Class<T> type) {
        return history.stream().filter(type::isInstance).map(type::cast).toList();
    }

    // --- mutation, orchestrator only, under lock ---

    boolean tryLock(long timeoutMs) throws InterruptedException {
        return lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Moves to {@code to} along a legal edge and records the transition.
     *
     * @throws ArbitrationException INVALID_STATE_TRANSITION, leaving the state unchanged
     */
    void transitionTo(ArbitrationState to, Instant at) {
        ArbitrationState from = state;
        StateTransitionTable.validate(from, to, id);
        if (from == ArbitrationState.COMPLETED) {
            if (firstCompletedAt == null) {
                firstCompletedAt = endTime;
            }
            history.add(new SessionRecord.SessionReopened(endTime, at));
            reopenedAt = at;
            endTime = null;
        }
        state = to;
        if (to.isTerminal()) {
            endTime = at;
        }
        history.add(new SessionRecord.StateTransition(from, to, at));
    }

    void record(SessionRecord entry) {
        history.add(entry);
    }

    void setPrecedents(List<Precedent> precedents) {
        this.precedents = List.copyOf(precedents);
    }

    void setVerdict(Verdict verdict) {
        this.verdict = verdict;
    }

    void setWaiver(WaiverRequest request, WaiverDecision decision) {
        this.waiverRequest = request;
        this.waiverDecision = decision;
    }

    @Override
    public String toString() {
        return "ArbitrationSession{id=" + id + ", state=" + state + ", rule=" + violation.ruleId() + "}";
    }
}
