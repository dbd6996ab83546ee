package com.arbiter.arbitration;

import com.arbiter.appeal.Appeal;
import com.arbiter.appeal.AppealArbitrator;
import com.arbiter.appeal.AppealDecision;
import com.arbiter.appeal.AppealPolicy;
import com.arbiter.appeal.AppealRecommendation;
import com.arbiter.appeal.EvidenceWeightedAssessor;
import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.contract.ConstitutionalViolation;
import com.arbiter.contract.ViolationContractValidator;
import com.arbiter.precedent.InMemoryPrecedentStore;
import com.arbiter.precedent.Precedent;
import com.arbiter.precedent.PrecedentManager;
import com.arbiter.precedent.PrecedentMatch;
import com.arbiter.rules.ActionContext;
import com.arbiter.rules.ConstitutionalRuleEngine;
import com.arbiter.rules.RuleEvaluation;
import com.arbiter.verdict.ConfidenceWeights;
import com.arbiter.verdict.Verdict;
import com.arbiter.verdict.VerdictGenerationResult;
import com.arbiter.verdict.VerdictGenerator;
import com.arbiter.waiver.WaiverDecision;
import com.arbiter.waiver.WaiverInterpreter;
import com.arbiter.waiver.WaiverPolicy;
import com.arbiter.waiver.WaiverRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static com.arbiter.arbitration.ArbitrationState.APPEAL_REVIEW;
import static com.arbiter.arbitration.ArbitrationState.COMPLETED;
import static com.arbiter.arbitration.ArbitrationState.EVIDENCE_COLLECTION;
import static com.arbiter.arbitration.ArbitrationState.FAILED;
import static com.arbiter.arbitration.ArbitrationState.RULE_EVALUATION;
import static com.arbiter.arbitration.ArbitrationState.VERDICT_GENERATION;
import static com.arbiter.arbitration.ArbitrationState.WAIVER_EVALUATION;

/**
 * Drives arbitration sessions through the protocol state machine.
 *
 * Flow: startSession, evaluateRules (with automatic precedent lookup unless
 * disabled), generateVerdict, then either completeSession, evaluateWaiver or
 * submitAppeal/reviewAppeal. Any unrecoverable error should end in
 * failSession so the session never dangles in a non-terminal state.
 *
 * Operations on one session are serialized by the session's lock; sessions
 * proceed independently of each other. The number of non-terminal sessions
 * never exceeds {@code maxConcurrentSessions}: a slot is taken at start or
 * reopen and released when the session reaches COMPLETED or FAILED.
 */
public class ArbitrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ArbitrationOrchestrator.class);

    private final OrchestratorSettings settings;
    private final ConstitutionalRuleEngine ruleEngine;
    private final PrecedentManager precedentManager;
    private final VerdictGenerator verdictGenerator;
    private final WaiverInterpreter waiverInterpreter;
    private final AppealArbitrator appealArbitrator;
    private final SessionRepository sessions;
    private final ViolationContractValidator validator;
    private final Clock clock;

    private final ConcurrentHashMap<String, SessionMetrics> metrics = new ConcurrentHashMap<>();
    private final AtomicInteger activeSlots = new AtomicInteger();
    private final AtomicLong sessionCounter = new AtomicLong();

    public ArbitrationOrchestrator() {
        this(OrchestratorSettings.defaults());
    }

    public ArbitrationOrchestrator(OrchestratorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    private ArbitrationOrchestrator(OrchestratorSettings settings, Clock clock) {
        this(settings, new ConstitutionalRuleEngine(),
            new PrecedentManager(new InMemoryPrecedentStore(), PrecedentManager.DEFAULT_MIN_SIMILARITY, clock),
            new VerdictGenerator(ConfidenceWeights.defaults(), VerdictGenerator.DEFAULT_MIN_REJECT_CONFIDENCE, clock),
            new WaiverInterpreter(WaiverPolicy.defaults(), clock),
            new AppealArbitrator(AppealPolicy.defaults(), new EvidenceWeightedAssessor(), clock),
            new InMemorySessionRepository(), new ViolationContractValidator(), clock);
    }

    public ArbitrationOrchestrator(OrchestratorSettings settings,
                                   ConstitutionalRuleEngine ruleEngine,
                                   PrecedentManager precedentManager,
                                   VerdictGenerator verdictGenerator,
                                   WaiverInterpreter waiverInterpreter,
                                   AppealArbitrator appealArbitrator,
                                   SessionRepository sessions,
                                   ViolationContractValidator validator,
                                   Clock clock) {
        this.settings = settings;
        this.ruleEngine = ruleEngine;
        this.precedentManager = precedentManager;
        this.verdictGenerator = verdictGenerator;
        this.waiverInterpreter = waiverInterpreter;
        this.appealArbitrator = appealArbitrator;
        this.sessions = sessions;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Opens a session in INITIALIZED and moves it straight to RULE_EVALUATION.
     *
     * @throws com.arbiter.contract.ContractViolationException on malformed input
     * @throws ArbitrationException SESSION_LIMIT_EXCEEDED at capacity
     */
    public ArbitrationSession startSession(ConstitutionalViolation violation,
                                           List<ConstitutionalRule> rules,
                                           List<String> participants) {
        validator.validate(violation, rules, participants);
        acquireSlot(null);

        Instant now = clock.instant();
        String sessionId = "ARB-" + now.toEpochMilli() + "-" + sessionCounter.incrementAndGet();
        ArbitrationSession session = new ArbitrationSession(sessionId, violation, rules, participants, now);
        sessions.save(session);
        if (settings.trackPerformance()) {
            metrics.put(sessionId, new SessionMetrics(sessionId));
        }
        session.lock();
        try {
            transition(session, RULE_EVALUATION);
        } finally {
            session.unlock();
        }
        log.info("Arbitration session {} started for rule {} (severity={}, candidates={}, participants={})",
            sessionId, violation.ruleId(), violation.severity(), rules.size(), participants.size());
        return session;
    }

    /**
     * Evaluates the violation against every candidate rule. With automatic
     * precedent application the session passes through EVIDENCE_COLLECTION
     * and precedent lookup; either way it ends in VERDICT_GENERATION.
     */
    public List<RuleEvaluation> evaluateRules(String sessionId) {
        return withSession(sessionId, session -> {
            requireState(session, RULE_EVALUATION, "evaluate rules");
            long started = System.nanoTime();
            ConstitutionalViolation violation = session.getViolation();
            List<ConstitutionalRule> candidates = session.getRulesEvaluated();
            candidates.forEach(ruleEngine::loadRule);
            ActionContext context = new ActionContext(
                violation.ruleId(),
                violation.violator(),
                violation.context(),
                Map.of("violator", violation.violator(), "severity", violation.severity().getValue()),
                violation.evidence(),
                violation.detectedAt()
            );
            List<RuleEvaluation> results = ruleEngine.evaluateRules(context, candidates);
            session.record(new SessionRecord.RulesEvaluated(results, clock.instant()));
            metricsOf(session).ifPresent(m -> m.recordRuleEvaluation(elapsedMs(started), candidates.size()));
            log.info("Session {} evaluated {} rules: {} applying",
                sessionId, results.size(), results.stream().filter(RuleEvaluation::applies).count());

            if (settings.autoApplyPrecedents()) {
                transition(session, EVIDENCE_COLLECTION);
                lookUpPrecedents(session);
            } else {
                transition(session, VERDICT_GENERATION);
            }
            return results;
        });
    }

    /**
     * Finds up to {@code precedentLookupLimit} similar precedents and moves the
     * session to VERDICT_GENERATION.
     */
    public List<Precedent> findPrecedents(String sessionId) {
        return withSession(sessionId, session -> {
            if (!StateTransitionTable.isAllowed(session.getState(), VERDICT_GENERATION)
                    || session.getState() == VERDICT_GENERATION) {
                throw invalidState(session, "find precedents");
            }
            return lookUpPrecedents(session);
        });
    }

    private List<Precedent> lookUpPrecedents(ArbitrationSession session) {
        long started = System.nanoTime();
        ConstitutionalViolation violation = session.getViolation();
        List<String> ruleIds = session.getRulesEvaluated().stream().map(ConstitutionalRule::id).toList();
        List<PrecedentMatch> matches = precedentManager.findSimilarPrecedents(
            session.getPrimaryRule().category(),
            violation.severity(),
            List.of(violation.description()),
            ruleIds,
            settings.precedentLookupLimit()
        );
        List<Precedent> found = matches.stream().map(PrecedentMatch::precedent).toList();
        session.setPrecedents(found);
        found.forEach(p -> precedentManager.cite(p.id()));
        session.record(new SessionRecord.PrecedentsApplied(found.stream().map(Precedent::id).toList(),
            clock.instant()));
        metricsOf(session).ifPresent(m -> m.recordPrecedentLookup(elapsedMs(started), found.size()));
        log.info("Session {} found {} precedents", session.getId(), found.size());
        transition(session, VERDICT_GENERATION);
        return found;
    }

    /**
     * Issues the verdict. Creates a precedent when the confidence is strictly
     * above the configured threshold. The session stays in VERDICT_GENERATION.
     */
    public Verdict generateVerdict(String sessionId, String issuedBy) {
        return withSession(sessionId, session -> {
            requireState(session, VERDICT_GENERATION, "generate verdict");
            VerdictGenerationResult result = verdictGenerator.generateVerdict(session.getId(),
                session.getVerdictsIssued() + 1, session.getViolation(), session.getRuleEvaluationResults(), session.getPrecedents(), issuedBy);
            Verdict verdict = result.verdict();
            session.setVerdict(verdict);
            session.record(new SessionRecord.VerdictIssued(verdict.id(), verdict.outcome(), verdict.confidence(),
                clock.instant()));
            metricsOf(session).ifPresent(m -> m.recordVerdictGeneration(Math.max(1L, result.generationTimeMs())));
            log.info("Session {} verdict {} outcome={} confidence={}",
                sessionId, verdict.id(), verdict.outcome(), verdict.confidence());

            apply(session, ArbitrationPhases.verdictEffects(session, verdict,
                settings.precedentConfidenceThreshold()));
            return verdict;
        });
    }

    /**
     * Decides a waiver for the session and completes it.
     *
     * @throws ArbitrationException WAIVERS_DISABLED (session untouched) or NO_VERDICT
     */
    public WaiverDecision evaluateWaiver(String sessionId, WaiverRequest request, String decidedBy) {
        if (!settings.enableWaivers()) {
            throw new ArbitrationException(ArbitrationErrorCode.WAIVERS_DISABLED,
                "Waiver system is disabled", sessionId);
        }
        return withSession(sessionId, session -> {
            if (session.getVerdict().isEmpty()) {
                throw new ArbitrationException(ArbitrationErrorCode.NO_VERDICT,
                    "Cannot evaluate waiver without verdict", sessionId);
            }
            if (session.getState() != VERDICT_GENERATION && session.getState() != WAIVER_EVALUATION) {
                throw invalidState(session, "evaluate waiver");
            }
            if (session.getState() == VERDICT_GENERATION) {
                transition(session, WAIVER_EVALUATION);
            }
            long started = System.nanoTime();
            ConstitutionalRule rule = session.getRulesEvaluated().stream()
                .filter(r -> r.id().equals(request.ruleId()))
                .findFirst()
                .orElse(session.getPrimaryRule());
            WaiverDecision decision = waiverInterpreter.processWaiver(request, rule, decidedBy);
            session.setWaiver(request, decision);
            session.record(new SessionRecord.WaiverEvaluated(request, decision, clock.instant()));
            metricsOf(session).ifPresent(m -> m.recordWaiverEvaluation(elapsedMs(started)));
            log.info("Session {} waiver {} decided {} ({})",
                sessionId, request.id(), decision.status(), decision.outcome());
            transition(session, COMPLETED);
            return decision;
        });
    }

    /**
     * Records an appeal and moves the session to APPEAL_REVIEW, reopening it
     * when it was already completed.
     *
     * @throws ArbitrationException APPEALS_DISABLED, NO_VERDICT, or
     *                              SESSION_LIMIT_EXCEEDED when reopening at capacity
     */
    public Appeal submitAppeal(String sessionId, String appellantId, String grounds, List<String> newEvidence) {
        if (!settings.enableAppeals()) {
            throw new ArbitrationException(ArbitrationErrorCode.APPEALS_DISABLED,
                "Appeal system is disabled", sessionId);
        }
        return withSession(sessionId, session -> {
            Verdict verdict = session.getVerdict().orElseThrow(() -> new ArbitrationException(
                ArbitrationErrorCode.NO_VERDICT, "Cannot appeal session without verdict", sessionId));
            boolean reopening = reserveAppealReview(session, "submit appeal");
            Appeal appeal;
            try {
                appeal = appealArbitrator.submitAppeal(sessionId, verdict, appellantId, grounds, newEvidence);
            } catch (RuntimeException e) {
                if (reopening) {
                    releaseSlot();
                }
                throw e;
            }
            if (session.getState() != APPEAL_REVIEW) {
                transition(session, APPEAL_REVIEW);
            }
            session.record(new SessionRecord.AppealSubmitted(appeal.id(), appellantId, clock.instant()));
            log.info("Session {} appeal {} submitted by {}", sessionId, appeal.id(), appellantId);
            return appeal;
        });
    }

    /** Records a reviewer's explicit vote on one of the session's appeals. */
    public Appeal castAppealVote(String sessionId, String appealId, String reviewerId,
                                 AppealRecommendation recommendation, String rationale) {
        if (!settings.enableAppeals()) {
            throw new ArbitrationException(ArbitrationErrorCode.APPEALS_DISABLED,
                "Appeal system is disabled", sessionId);
        }
        return withSession(sessionId, session -> {
            requireAppealOf(session, appealId);
            return appealArbitrator.castVote(appealId, reviewerId, recommendation, rationale);
        });
    }

    /**
     * Reviews an appeal and completes the session. An overturn replaces the
     * session's verdict, keeps the old one in the history and records the
     * replacement as an "Appeal Overturn" precedent.
     *
     * @throws ArbitrationException NO_VERDICT, APPEAL_NOT_FOUND, APPEAL_ALREADY_DECIDED
     */
    public AppealDecision reviewAppeal(String sessionId, String appealId, List<String> reviewers) {
        return withSession(sessionId, session -> {
            Verdict verdict = session.getVerdict().orElseThrow(() -> new ArbitrationException(
                ArbitrationErrorCode.NO_VERDICT, "Cannot review appeal without verdict", sessionId));
            if (!settings.enableAppeals()) {
                throw new ArbitrationException(ArbitrationErrorCode.APPEALS_DISABLED,
                    "Appeal system is disabled", sessionId);
            }
            Appeal appeal = requireAppealOf(session, appealId);
            if (!appeal.status().isOpen()) {
                throw new ArbitrationException(ArbitrationErrorCode.APPEAL_ALREADY_DECIDED,
                    "Appeal " + appealId + " was already decided: " + appeal.status(), sessionId);
            }
            boolean reopening = reserveAppealReview(session, "review appeal");
            AppealDecision decision;
            try {
                decision = appealArbitrator.reviewAppeal(appealId, reviewers, verdict);
            } catch (RuntimeException e) {
                if (reopening) {
                    releaseSlot();
                }
                throw e;
            }
            if (session.getState() != APPEAL_REVIEW) {
                transition(session, APPEAL_REVIEW);
            }
            session.record(new SessionRecord.AppealDecided(decision, clock.instant()));
            apply(session, ArbitrationPhases.appealEffects(session, decision));
            metricsOf(session).ifPresent(m -> m.recordAppealReview(timeInAppealReview(session)));
            log.info("Session {} appeal {} decided {} (confidence={})",
                sessionId, appealId, decision.decision(), decision.confidence());
            transition(session, COMPLETED);
            return decision;
        });
    }

    /** Completes the session. Does nothing when it is already COMPLETED. */
    public ArbitrationSession completeSession(String sessionId) {
        return withSession(sessionId, session -> {
            if (session.getState() == COMPLETED) {
                return session;
            }
            transition(session, COMPLETED);
            return session;
        });
    }

    /**
     * Fails the session, recording the error in its history.
     *
     * @throws ArbitrationException INVALID_STATE_TRANSITION when the session is already terminal
     */
    public ArbitrationSession failSession(String sessionId, Throwable error) {
        return withSession(sessionId, session -> {
            StateTransitionTable.validate(session.getState(), FAILED, sessionId);
            fail(session, error);
            return session;
        });
    }

    /** Appends a caller-defined annotation to the session's history. */
    public void annotate(String sessionId, String key, String value) {
        withSession(sessionId, session -> {
            session.record(new SessionRecord.Annotation(key, value, clock.instant()));
            return null;
        });
    }

    /**
     * Fails every non-terminal session older than {@code sessionTimeoutMs}.
     * Reopened sessions are timed from the reopening. Sessions busy with
     * another operation are left for the next sweep.
     *
     * @return ids of the sessions failed
     */
    public List<String> expireTimedOutSessions() {
        Instant now = clock.instant();
        Duration timeout = Duration.ofMillis(settings.sessionTimeoutMs());
        List<String> expired = new ArrayList<>();
        for (ArbitrationSession session : sessions.findAll()) {
            if (session.getState().isTerminal() || !isOverdue(session, now, timeout)) {
                continue;
            }
            try {
                if (!session.tryLock(0)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                ArbitrationState state = session.getState();
                if (!state.isTerminal() && isOverdue(session, now, timeout)) {
                    log.warn("Session {} timed out in state {}", session.getId(), state);
                    fail(session, new ArbitrationException(ArbitrationErrorCode.SESSION_TIMEOUT,
                        "Session " + session.getId() + " exceeded timeout of " + settings.sessionTimeoutMs() + "ms",
                        session.getId()));
                    expired.add(session.getId());
                }
            } finally {
                session.unlock();
            }
        }
        return expired;
    }

    private static boolean isOverdue(ArbitrationSession session, Instant now, Duration timeout) {
        Instant since = session.getReopenedAt().orElse(session.getStartTime());
        return Duration.between(since, now).compareTo(timeout) > 0;
    }

    // --- queries ---

    /** @throws ArbitrationException SESSION_NOT_FOUND */
    public ArbitrationSession getSession(String sessionId) {
        return findSession(sessionId).orElseThrow(() -> new ArbitrationException(
            ArbitrationErrorCode.SESSION_NOT_FOUND, "Session " + sessionId + " not found", sessionId));
    }

    public Optional<ArbitrationSession> findSession(String sessionId) {
        return sessions.findById(sessionId);
    }

    public List<ArbitrationSession> getActiveSessions() {
        return sessions.findAll().stream().filter(s -> !s.getState().isTerminal()).toList();
    }

    /** Empty when the session is unknown or performance tracking is off. */
    public Optional<SessionMetrics> getSessionMetrics(String sessionId) {
        return Optional.ofNullable(metrics.get(sessionId));
    }

    public List<SessionMetrics> getAllMetrics() {
        return List.copyOf(metrics.values());
    }

    public ArbitrationComponents getComponents() {
        return new ArbitrationComponents(ruleEngine, verdictGenerator, waiverInterpreter,
            precedentManager, appealArbitrator);
    }

    public OrchestratorSettings getSettings() {
        return settings;
    }

    public OrchestratorStatistics getStatistics() {
        long total = 0;
        long active = 0;
        long completed = 0;
        long failed = 0;
        long waivers = 0;
        long durationTotal = 0;
        long ended = 0;
        for (ArbitrationSession session : sessions.findAll()) {
            total++;
            switch (session.getState()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                default -> active++;
            }
            if (session.getWaiverDecision().isPresent()) {
                waivers++;
            }
            Optional<Instant> end = session.getEndTime();
            if (end.isPresent()) {
                durationTotal += Duration.between(session.getStartTime(), end.get()).toMillis();
                ended++;
            }
        }
        return new OrchestratorStatistics(total, active, completed, failed,
            ended == 0 ? 0.0 : (double) durationTotal / ended,
            precedentManager.getStatistics().totalPrecedents(),
            appealArbitrator.getStatistics().totalAppeals(),
            waivers);
    }

    /** Drops all sessions, metrics and component state. */
    public void clear() {
        sessions.clear();
        metrics.clear();
        activeSlots.set(0);
        ruleEngine.clear();
        precedentManager.clear();
        waiverInterpreter.clear();
        appealArbitrator.clear();
        log.info("Arbitration orchestrator cleared");
    }

    // --- internals ---

    private <T> T withSession(String sessionId, Function<ArbitrationSession, T> operation) {
        ArbitrationSession session = getSession(sessionId);
        session.lock();
        try {
            return operation.apply(session);
        } finally {
            session.unlock();
        }
    }

    /**
     * Checks that the session may enter appeal review and takes a capacity
     * slot when that means reopening a completed session.
     *
     * @return true when a slot was taken
     */
    private boolean reserveAppealReview(ArbitrationSession session, String operation) {
        ArbitrationState state = session.getState();
        if (state == APPEAL_REVIEW) {
            return false;
        }
        if (state != VERDICT_GENERATION && state != WAIVER_EVALUATION && state != COMPLETED) {
            throw invalidState(session, operation);
        }
        if (state == COMPLETED) {
            acquireSlot(session.getId());
            return true;
        }
        return false;
    }

    private Appeal requireAppealOf(ArbitrationSession session, String appealId) {
        return appealArbitrator.getAppeal(appealId)
            .filter(a -> a.sessionId().equals(session.getId()))
            .orElseThrow(() -> new ArbitrationException(ArbitrationErrorCode.APPEAL_NOT_FOUND,
                "Appeal " + appealId + " not found for session " + session.getId(), session.getId()));
    }

    private void fail(ArbitrationSession session, Throwable error) {
        session.record(new SessionRecord.SessionFailed(SessionRecord.ErrorDetail.of(error), clock.instant()));
        transition(session, FAILED);
        log.warn("Session {} failed: {}", session.getId(), error.getMessage());
    }

    /**
     * Single place where state changes. A terminal target sets the end time,
     * releases the capacity slot and freezes the metrics; leaving COMPLETED
     * thaws them again (the slot was taken by the caller).
     */
    private void transition(ArbitrationSession session, ArbitrationState to) {
        ArbitrationState from = session.getState();
        Instant now = clock.instant();
        session.transitionTo(to, now);
        Optional<SessionMetrics> sessionMetrics = metricsOf(session);
        if (from == COMPLETED) {
            sessionMetrics.ifPresent(SessionMetrics::reopen);
            log.info("Session {} reopened for {}", session.getId(), to);
        }
        if (to.isTerminal()) {
            releaseSlot();
            long total = Duration.between(session.getStartTime(), now).toMillis();
            sessionMetrics.ifPresent(m -> m.close(to, total));
            if (to == COMPLETED) {
                log.info("Session {} completed in {}ms", session.getId(), total);
            }
        }
        log.debug("Session {} transition {} -> {}", session.getId(), from, to);
    }

    private void apply(ArbitrationSession session, List<SessionEffect> effects) {
        for (SessionEffect effect : effects) {
            if (effect instanceof SessionEffect.CreatePrecedent create) {
                Precedent precedent = precedentManager.createPrecedent(create.verdict(), create.title(),
                    create.keyFacts(), create.reasoningSummary(), create.applicability());
                log.info("Session {} produced precedent {}", session.getId(), precedent.id());
            } else if (effect instanceof SessionEffect.ReplaceVerdict replace) {
                Verdict previous = session.getVerdict().orElse(null);
                session.record(new SessionRecord.VerdictSuperseded(previous, replace.newVerdict(),
                    replace.appealId(), clock.instant()));
                session.setVerdict(replace.newVerdict());
                log.info("Session {} verdict {} replaced by {} after appeal {}", session.getId(),
                    previous == null ? null : previous.id(), replace.newVerdict().id(), replace.appealId());
            }
        }
    }

    private void acquireSlot(String sessionId) {
        while (true) {
            int current = activeSlots.get();
            if (current >= settings.maxConcurrentSessions()) {
                throw new ArbitrationException(ArbitrationErrorCode.SESSION_LIMIT_EXCEEDED,
                    "Maximum concurrent sessions reached", sessionId);
            }
            if (activeSlots.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    private void releaseSlot() {
        activeSlots.updateAndGet(current -> Math.max(0, current - 1));
    }

    private long timeInAppealReview(ArbitrationSession session) {
        List<SessionRecord.StateTransition> transitions = session.getStateTransitions();
        for (int i = transitions.size() - 1; i >= 0; i--) {
            if (transitions.get(i).to() == APPEAL_REVIEW) {
                return Math.max(1L, Duration.between(transitions.get(i).at(), clock.instant()).toMillis());
            }
        }
        return 1L;
    }

    private Optional<SessionMetrics> metricsOf(ArbitrationSession session) {
        return Optional.ofNullable(metrics.get(session.getId()));
    }

    private static void requireState(ArbitrationSession session, ArbitrationState required, String operation) {
        if (session.getState() != required) {
            throw invalidState(session, operation);
        }
    }

    private static ArbitrationException invalidState(ArbitrationSession session, String operation) {
        return new ArbitrationException(ArbitrationErrorCode.INVALID_STATE,
            "Cannot " + operation + " in state " + session.getState(), session.getId());
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
