package com.arbiter.arbitration;

import com.arbiter.appeal.AppealArbitrator;
import com.arbiter.appeal.EvidenceWeightedAssessor;
import com.arbiter.contract.ViolationContractValidator;
import com.arbiter.precedent.InMemoryPrecedentStore;
import com.arbiter.precedent.PrecedentManager;
import com.arbiter.rules.ConstitutionalRuleEngine;
import com.arbiter.verdict.VerdictGenerator;
import com.arbiter.waiver.WaiverInterpreter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ArbitrationConfiguration {

    @Bean
    public Clock arbitrationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ViolationContractValidator violationContractValidator() {
        return new ViolationContractValidator();
    }

    @Bean
    public ConstitutionalRuleEngine constitutionalRuleEngine(ViolationContractValidator validator) {
        return new ConstitutionalRuleEngine(validator);
    }

    /** In-memory store; swap the bean for a persistent {@code PrecedentStore} to keep precedents across restarts. */
    @Bean
    public PrecedentManager precedentManager(ArbitrationProperties properties, Clock arbitrationClock) {
        return new PrecedentManager(new InMemoryPrecedentStore(), properties.getPrecedent().getMinSimilarity(),
            arbitrationClock);
    }

    @Bean
    public VerdictGenerator verdictGenerator(ArbitrationProperties properties, Clock arbitrationClock) {
        return new VerdictGenerator(properties.getVerdict().toWeights(),
            properties.getVerdict().getMinRejectConfidence(), arbitrationClock);
    }

    @Bean
    public WaiverInterpreter waiverInterpreter(ArbitrationProperties properties, Clock arbitrationClock) {
        return new WaiverInterpreter(properties.getWaiver().toPolicy(), arbitrationClock);
    }

    @Bean
    public AppealArbitrator appealArbitrator(ArbitrationProperties properties, Clock arbitrationClock) {
        return new AppealArbitrator(properties.getAppeal().toPolicy(), new EvidenceWeightedAssessor(),
            arbitrationClock);
    }

    @Bean
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    @Bean
    public ArbitrationOrchestrator arbitrationOrchestrator(ArbitrationProperties properties,
                                                           ConstitutionalRuleEngine ruleEngine,
                                                           PrecedentManager precedentManager,
                                                           VerdictGenerator verdictGenerator,
                                                           WaiverInterpreter waiverInterpreter,
                                                           AppealArbitrator appealArbitrator,
                                                           SessionRepository sessionRepository,
                                                           ViolationContractValidator validator,
                                                           Clock arbitrationClock) {
        return new ArbitrationOrchestrator(properties.toSettings(), ruleEngine, precedentManager,
            verdictGenerator, waiverInterpreter, appealArbitrator, sessionRepository, validator, arbitrationClock);
    }

    @Bean
    public SessionAuditExporter sessionAuditExporter(ArbitrationOrchestrator orchestrator, ObjectMapper objectMapper) {
        return new SessionAuditExporter(orchestrator, objectMapper);
    }
}
