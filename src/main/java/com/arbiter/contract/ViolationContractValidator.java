package com.arbiter.contract;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Boundary checks for everything the detection collaborator hands to
 * {@code startSession}. Fails on the first broken field.
 */
public class ViolationContractValidator {

    public void validate(ConstitutionalViolation violation,
                         List<ConstitutionalRule> rules,
                         List<String> participants) {
        requireNonNull(violation, "violation is required");
        requireString(violation.ruleId(), "violation.rule_id is required");
        requireNonNull(violation.severity(), "violation.severity is required");
        requireString(violation.description(), "violation.description is required");
        requireNonNull(violation.detectedAt(), "violation.detected_at is required");

        requireNonNull(rules, "rules are required");
        if (rules.isEmpty()) {
            throw new ContractViolationException("at least one candidate rule is required");
        }
        Set<String> seen = new HashSet<>();
        for (ConstitutionalRule rule : rules) {
            validateRule(rule);
            if (!seen.add(rule.id())) {
                throw new ContractViolationException("duplicate candidate rule: " + rule.id());
            }
        }

        requireNonNull(participants, "participants are required");
        for (String participant : participants) {
            requireString(participant, "participant ids must be non-blank");
        }
    }

    public void validateRule(ConstitutionalRule rule) {
        requireNonNull(rule, "rule cannot be null");
        requireString(rule.id(), "rule.id is required");
        requireNonNull(rule.category(), "rule.category is required for " + rule.id());
        requireNonNull(rule.severity(), "rule.severity is required for " + rule.id());
        if (rule.effectiveDate() != null && rule.expirationDate() != null
                && !rule.expirationDate().isAfter(rule.effectiveDate())) {
            throw new ContractViolationException(
                "rule.expiration_date must be after effective_date for " + rule.id());
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }

    private String requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
        return value;
    }
}
