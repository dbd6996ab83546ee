package com.arbiter.arbitration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails sessions that outlive {@code arbitration.session-timeout-ms}.
 */
@Component
public class SessionTimeoutSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SessionTimeoutSupervisor.class);

    private final ArbitrationOrchestrator orchestrator;

    public SessionTimeoutSupervisor(ArbitrationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${arbitration.timeout-sweep-interval-ms:30000}",
        initialDelayString = "${arbitration.timeout-sweep-interval-ms:30000}")
    public void sweep() {
        List<String> expired = orchestrator.expireTimedOutSessions();
        if (!expired.isEmpty()) {
            log.warn("Timeout sweep failed {} session(s): {}", expired.size(), expired);
        }
    }
}
