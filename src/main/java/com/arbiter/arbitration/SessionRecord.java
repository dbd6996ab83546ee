package com.arbiter.arbitration;

import com.arbiter.appeal.AppealDecision;
import com.arbiter.rules.RuleEvaluation;
import com.arbiter.verdict.Verdict;
import com.arbiter.verdict.VerdictOutcome;
import com.arbiter.waiver.WaiverDecision;
import com.arbiter.waiver.WaiverRequest;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a session's append-only audit history.
 * {@link Annotation} carries caller-defined extension fields.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SessionRecord.StateTransition.class, name = "state_transition"),
    @JsonSubTypes.Type(value = SessionRecord.RulesEvaluated.class, name = "rules_evaluated"),
    @JsonSubTypes.Type(value = SessionRecord.PrecedentsApplied.class, name = "precedents_applied"),
    @JsonSubTypes.Type(value = SessionRecord.VerdictIssued.class, name = "verdict_issued"),
    @JsonSubTypes.Type(value = SessionRecord.VerdictSuperseded.class, name = "verdict_superseded"),
    @JsonSubTypes.Type(value = SessionRecord.WaiverEvaluated.class, name = "waiver_evaluated"),
    @JsonSubTypes.Type(value = SessionRecord.AppealSubmitted.class, name = "appeal_submitted"),
    @JsonSubTypes.Type(value = SessionRecord.AppealDecided.class, name = "appeal_decided"),
    @JsonSubTypes.Type(value = SessionRecord.SessionReopened.class, name = "session_reopened"),
    @JsonSubTypes.Type(value = SessionRecord.SessionFailed.class, name = "session_failed"),
    @JsonSubTypes.Type(value = SessionRecord.Annotation.class, name = "annotation")
})
public sealed interface SessionRecord {

    Instant at();

    record StateTransition(ArbitrationState from, ArbitrationState to, Instant at) implements SessionRecord {}

    record RulesEvaluated(List<RuleEvaluation> results, Instant at) implements SessionRecord {
        public RulesEvaluated {
            results = List.copyOf(results);
        }
    }

    record PrecedentsApplied(List<String> precedentIds, Instant at) implements SessionRecord {
        public PrecedentsApplied {
            precedentIds = List.copyOf(precedentIds);
        }
    }

    record VerdictIssued(String verdictId, VerdictOutcome outcome, double confidence, Instant at)
        implements SessionRecord {}

    /** The previous verdict stays here after an overturning appeal replaces it. */
    record VerdictSuperseded(Verdict previous, Verdict replacement, String appealId, Instant at)
        implements SessionRecord {}

    record WaiverEvaluated(WaiverRequest request, WaiverDecision decision, Instant at) implements SessionRecord {}

    record AppealSubmitted(String appealId, String appellantId, Instant at) implements SessionRecord {}

    record AppealDecided(AppealDecision decision, Instant at) implements SessionRecord {}

    record SessionReopened(Instant previousEndTime, Instant at) implements SessionRecord {}

    record SessionFailed(ErrorDetail error, Instant at) implements SessionRecord {}

    record Annotation(String key, String value, Instant at) implements SessionRecord {}

    /** Error captured when a session is failed. */
    record ErrorDetail(String message, String type, String code) {

        static ErrorDetail of(Throwable error) {
            String code = error instanceof ArbitrationException ae ? ae.getCode().name() : null;
            String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
            return new ErrorDetail(message, error.getClass().getName(), code);
        }
    }
}
