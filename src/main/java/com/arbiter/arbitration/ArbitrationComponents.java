package com.arbiter.arbitration;

import com.arbiter.appeal.AppealArbitrator;
import com.arbiter.precedent.PrecedentManager;
import com.arbiter.rules.ConstitutionalRuleEngine;
import com.arbiter.verdict.VerdictGenerator;
import com.arbiter.waiver.WaiverInterpreter;

/** The collaborators an orchestrator drives. */
public record ArbitrationComponents(
    ConstitutionalRuleEngine ruleEngine,
    VerdictGenerator verdictGenerator,
    WaiverInterpreter waiverInterpreter,
    PrecedentManager precedentManager,
    AppealArbitrator appealArbitrator
) {
}
