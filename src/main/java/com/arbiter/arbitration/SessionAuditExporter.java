package com.arbiter.arbitration;

import com.arbiter.precedent.Precedent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders sessions as JSON audit reports.
 */
public class SessionAuditExporter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuditExporter.class);

    private final ArbitrationOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public SessionAuditExporter(ArbitrationOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    /** @throws ArbitrationException SESSION_NOT_FOUND */
    public SessionAuditReport report(String sessionId) {
        ArbitrationSession session = orchestrator.getSession(sessionId);
        return new SessionAuditReport(
            session.getId(),
            session.getState(),
            session.getViolation().ruleId(),
            session.getViolation().violator(),
            session.getViolation().severity(),
            session.getParticipants(),
            session.getStartTime(),
            session.getEndTime().orElse(null),
            session.getFirstCompletedAt().orElse(null),
            session.getReopenedAt().orElse(null),
            session.getPrecedents().stream().map(Precedent::id).toList(),
            session.getVerdict().orElse(null),
            session.getSupersededVerdicts(),
            session.getWaiverDecision().orElse(null),
            session.getAppealDecisions(),
            orchestrator.getSessionMetrics(sessionId).map(SessionAuditReport.MetricsSnapshot::of).orElse(null),
            session.getHistory()
        );
    }

    public String exportJson(String sessionId) {
        SessionAuditReport report = report(sessionId);
        try {
            String json = objectMapper.writeValueAsString(report);
            log.debug("Exported audit report for session {} ({} history entries)",
                sessionId, report.history().size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit report for session " + sessionId, e);
        }
    }
}
