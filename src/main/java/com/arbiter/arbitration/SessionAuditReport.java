package com.arbiter.arbitration;

import com.arbiter.appeal.AppealDecision;
import com.arbiter.contract.ViolationSeverity;
import com.arbiter.verdict.Verdict;
import com.arbiter.waiver.WaiverDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Audit view of one session for the downstream audit log and
 * compliance-reporting collaborators.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionAuditReport(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("state") ArbitrationState state,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("violator") String violator,
    @JsonProperty("severity") ViolationSeverity severity,
    @JsonProperty("participants") List<String> participants,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("first_completed_at") Instant firstCompletedAt,
    @JsonProperty("reopened_at") Instant reopenedAt,
    @JsonProperty("precedent_ids") List<String> precedentIds,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("superseded_verdicts") List<Verdict> supersededVerdicts,
    @JsonProperty("waiver_decision") WaiverDecision waiverDecision,
    @JsonProperty("appeal_decisions") List<AppealDecision> appealDecisions,
    @JsonProperty("metrics") MetricsSnapshot metrics,
    @JsonProperty("history") List<SessionRecord> history
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MetricsSnapshot(
        @JsonProperty("rule_evaluation_ms") long ruleEvaluationMs,
        @JsonProperty("precedent_lookup_ms") long precedentLookupMs,
        @JsonProperty("verdict_generation_ms") long verdictGenerationMs,
        @JsonProperty("waiver_evaluation_ms") Long waiverEvaluationMs,
        @JsonProperty("appeal_review_ms") Long appealReviewMs,
        @JsonProperty("rules_evaluated") int rulesEvaluated,
        @JsonProperty("precedents_found") int precedentsFound,
        @JsonProperty("total_duration_ms") long totalDurationMs,
        @JsonProperty("final_state") ArbitrationState finalState,
        @JsonProperty("reopen_count") int reopenCount
    ) {

        static MetricsSnapshot of(SessionMetrics metrics) {
            return new MetricsSnapshot(metrics.getRuleEvaluationMs(), metrics.getPrecedentLookupMs(),
                metrics.getVerdictGenerationMs(), metrics.getWaiverEvaluationMs(), metrics.getAppealReviewMs(),
                metrics.getRulesEvaluated(), metrics.getPrecedentsFound(), metrics.getTotalDurationMs(),
                metrics.getFinalState(), metrics.getReopenCount());
        }
    }
}
