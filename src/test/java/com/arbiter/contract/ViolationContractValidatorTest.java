package com.arbiter.contract;

import com.arbiter.ArbitrationFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViolationContractValidatorTest {

    private ViolationContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ViolationContractValidator();
    }

    @Nested
    @DisplayName("Violation fields")
    class ViolationFields {

        @Test
        void validViolation_passes() {
            assertDoesNotThrow(() -> validator.validate(ArbitrationFixtures.lintViolation(),
                List.of(ArbitrationFixtures.lintRule()), List.of("agent-7", "reviewer-1")));
        }

        @Test
        void nullViolation_rejected() {
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(null, List.of(ArbitrationFixtures.lintRule()), List.of()));
            assertTrue(ex.getMessage().contains("violation"));
        }

        @Test
        void missingRuleId_rejected() {
            ConstitutionalViolation violation = new ConstitutionalViolation("v-1", " ", "agent-7",
                ViolationSeverity.LOW, "desc", Map.of(), Instant.now(), List.of());
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(violation, List.of(ArbitrationFixtures.lintRule()), List.of()));
            assertTrue(ex.getMessage().contains("rule_id"));
        }

        @Test
        void missingSeverity_rejected() {
            ConstitutionalViolation violation = new ConstitutionalViolation("v-1", "CODE-001", "agent-7",
                null, "desc", Map.of(), Instant.now(), List.of());
            assertThrows(ContractViolationException.class,
                () -> validator.validate(violation, List.of(ArbitrationFixtures.lintRule()), List.of()));
        }

        @Test
        void blankViolator_defaultsToUnknown() {
            ConstitutionalViolation violation = new ConstitutionalViolation("v-1", "CODE-001", null,
                ViolationSeverity.LOW, "desc", null, Instant.now(), null);
            assertEquals(ConstitutionalViolation.UNKNOWN_VIOLATOR, violation.violator());
            assertTrue(violation.context().isEmpty());
        }
    }

    @Nested
    @DisplayName("Candidate rules and participants")
    class RulesAndParticipants {

        @Test
        void emptyRuleList_rejected() {
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(ArbitrationFixtures.lintViolation(), List.of(), List.of()));
            assertTrue(ex.getMessage().contains("at least one"));
        }

        @Test
        void duplicateRule_rejected() {
            ConstitutionalRule rule = ArbitrationFixtures.lintRule();
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(ArbitrationFixtures.lintViolation(), List.of(rule, rule), List.of()));
            assertTrue(ex.getMessage().contains("CODE-001"));
        }

        @Test
        void blankParticipant_rejected() {
            assertThrows(ContractViolationException.class,
                () -> validator.validate(ArbitrationFixtures.lintViolation(),
                    List.of(ArbitrationFixtures.lintRule()), List.of("agent-7", "")));
        }

        @Test
        void ruleExpiringBeforeItStarts_rejected() {
            ConstitutionalRule rule = new ConstitutionalRule("R-1", "1", RuleCategory.PROCESS, "t", "d", "",
                ViolationSeverity.LOW, true, List.of(), Instant.parse("2024-06-01T00:00:00Z"),
                Instant.parse("2024-05-01T00:00:00Z"), Map.of());
            assertThrows(ContractViolationException.class, () -> validator.validateRule(rule));
        }
    }

    @Test
    void severity_parsesLowercaseAndName() {
        assertEquals(ViolationSeverity.HIGH, ViolationSeverity.fromValue("high"));
        assertEquals(ViolationSeverity.HIGH, ViolationSeverity.fromValue("HIGH"));
        assertEquals(3, ViolationSeverity.LOW.distanceTo(ViolationSeverity.CRITICAL));
        assertThrows(IllegalArgumentException.class, () -> ViolationSeverity.fromValue("severe"));
    }
}
