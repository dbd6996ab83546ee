package com.arbiter.rules;

import com.arbiter.contract.ConstitutionalRule;
import com.arbiter.contract.ViolationContractValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stateless rule evaluator shared by all sessions.
 *
 * State is limited to the loaded-rule registry and a cache of compiled
 * conditions keyed by expression. The registry grows append-only: the first
 * rule loaded under an id stays registered, later loads of that id are no-ops.
 * {@link #evaluateRules} judges the rule objects it is given and never
 * consults the registry, so sessions carrying different versions of the same
 * rule id do not see each other's conditions.
 *
 * Strength of an applying rule:
 * <ul>
 *   <li>0.5 when the action names the rule directly</li>
 *   <li>+0.4 when the condition is violated, +0.2 when it is indeterminate</li>
 *   <li>+0.1 x coverage of the rule's required evidence</li>
 * </ul>
 * A satisfied condition means the rule does not apply (strength 0).
 */
public class ConstitutionalRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(ConstitutionalRuleEngine.class);

    static final double DIRECT_REFERENCE_WEIGHT = 0.5;
    static final double VIOLATED_WEIGHT = 0.4;
    static final double INDETERMINATE_WEIGHT = 0.2;
    static final double EVIDENCE_WEIGHT = 0.1;

    private final ViolationContractValidator validator;
    private final ConcurrentHashMap<String, LoadedRule> rules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RuleCondition> conditions = new ConcurrentHashMap<>();

    public ConstitutionalRuleEngine() {
        this(new ViolationContractValidator());
    }

    public ConstitutionalRuleEngine(ViolationContractValidator validator) {
        this.validator = validator;
    }

    /**
     * Registers a rule for the lifetime of this engine. Idempotent per rule id.
     *
     * @return true if the id was not loaded before
     */
    public boolean loadRule(ConstitutionalRule rule) {
        validator.validateRule(rule);
        LoadedRule candidate = new LoadedRule(rule, compiled(rule));
        LoadedRule existing = rules.putIfAbsent(rule.id(), candidate);
        if (existing != null) {
            if (!existing.rule().equals(rule)) {
                log.debug("Rule {} already loaded with version={}, ignoring version={}",
                    rule.id(), existing.rule().version(), rule.version());
            }
            return false;
        }
        log.debug("Loaded rule {} version={}", rule.id(), rule.version());
        return true;
    }

    public Optional<ConstitutionalRule> getRule(String ruleId) {
        LoadedRule loaded = rules.get(ruleId);
        return loaded == null ? Optional.empty() : Optional.of(loaded.rule());
    }

    public Collection<ConstitutionalRule> getLoadedRules() {
        return rules.values().stream().map(LoadedRule::rule).toList();
    }

    public int size() {
        return rules.size();
    }

    /**
     * Evaluates the action against each requested rule, in request order.
     * Unknown ids yield NOT_APPLICABLE rather than an error.
     */
    public List<RuleEvaluation> evaluateAction(ActionContext context, List<String> ruleIds) {
        List<RuleEvaluation> results = new ArrayList<>(ruleIds.size());
        for (String ruleId : ruleIds) {
            LoadedRule loaded = rules.get(ruleId);
            RuleEvaluation evaluation = loaded == null
                ? RuleEvaluation.notApplicable(ruleId, null, null, "Rule " + ruleId + " is not loaded")
                : evaluateOne(context, loaded.rule(), loaded.condition());
            log.debug("Rule {} -> status={} strength={}", ruleId, evaluation.status(), evaluation.strength());
            results.add(evaluation);
        }
        return results;
    }

    /**
     * Evaluates the action against the given rules themselves, in order,
     * whatever version of each id the registry holds.
     *
     * @throws com.arbiter.contract.ContractViolationException when a condition cannot be parsed
     */
    public List<RuleEvaluation> evaluateRules(ActionContext context, List<ConstitutionalRule> candidates) {
        List<RuleEvaluation> results = new ArrayList<>(candidates.size());
        for (ConstitutionalRule rule : candidates) {
            RuleEvaluation evaluation = evaluateOne(context, rule, compiled(rule));
            log.debug("Rule {} v{} -> status={} strength={}",
                rule.id(), rule.version(), evaluation.status(), evaluation.strength());
            results.add(evaluation);
        }
        return results;
    }

    private RuleCondition compiled(ConstitutionalRule rule) {
        String expression = rule.condition() == null ? "" : rule.condition().trim();
        return conditions.computeIfAbsent(expression, RuleCondition::compile);
    }

    private RuleEvaluation evaluateOne(ActionContext context, ConstitutionalRule rule, RuleCondition condition) {
        String ruleId = rule.id();
        if (!rule.isInEffectAt(context.timestamp())) {
            return RuleEvaluation.notApplicable(ruleId, rule.category(), rule.severity(),
                "Rule " + ruleId + " is not in effect at " + context.timestamp());
        }

        boolean direct = ruleId.equals(context.action());
        RuleConditionStatus status = condition.isEmpty() && direct
            ? RuleConditionStatus.VIOLATED
            : condition.evaluate(context.parameters(), context.environment());

        List<String> missing = EvidenceMatcher.missing(rule.requiredEvidence(), context.evidence());
        double coverage = EvidenceMatcher.coverage(rule.requiredEvidence(), context.evidence());

        double strength = 0.0;
        if (status != RuleConditionStatus.SATISFIED) {
            if (direct) {
                strength += DIRECT_REFERENCE_WEIGHT;
            }
            strength += status == RuleConditionStatus.VIOLATED ? VIOLATED_WEIGHT : INDETERMINATE_WEIGHT;
            strength += EVIDENCE_WEIGHT * coverage;
        }
        strength = round(Math.min(1.0, strength));

        return new RuleEvaluation(ruleId, rule.category(), rule.severity(), status, strength,
            round(coverage), missing, direct, explain(rule, condition, status, direct, missing));
    }

    private String explain(ConstitutionalRule rule, RuleCondition condition, RuleConditionStatus status,
                           boolean direct, List<String> missing) {
        StringBuilder text = new StringBuilder("Rule ").append(rule.id());
        switch (status) {
            case VIOLATED -> text.append(condition.isEmpty()
                ? " was reported as violated"
                : " condition '" + condition.expression() + "' is not met");
            case SATISFIED -> text.append(" condition '").append(condition.expression()).append("' is met");
            case INDETERMINATE -> text.append(condition.isEmpty()
                ? " has no condition to check"
                : " cannot be decided from context over " + condition.referencedPaths());
            case NOT_APPLICABLE -> text.append(" does not apply");
        }
        if (direct) {
            text.append("; violation references this rule directly");
        }
        if (!missing.isEmpty()) {
            text.append("; missing evidence ").append(missing);
        }
        return text.toString();
    }

    public void clear() {
        rules.clear();
        conditions.clear();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private record LoadedRule(ConstitutionalRule rule, RuleCondition condition) {
    }
}
