package com.arbiter.rules;

import com.arbiter.contract.ContractViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleConditionTest {

    private static RuleConditionStatus eval(String expression, Map<String, Object> parameters) {
        return RuleCondition.compile(expression).evaluate(parameters, Map.of());
    }

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        void strictEquality_onBoolean() {
            assertEquals(RuleConditionStatus.SATISFIED, eval("linted === true", Map.of("linted", true)));
            assertEquals(RuleConditionStatus.VIOLATED, eval("linted === true", Map.of("linted", false)));
        }

        @Test
        void numericOrdering() {
            assertEquals(RuleConditionStatus.SATISFIED, eval("coverage >= 80", Map.of("coverage", 80)));
            assertEquals(RuleConditionStatus.VIOLATED, eval("coverage >= 80", Map.of("coverage", 79.5)));
            assertEquals(RuleConditionStatus.SATISFIED, eval("cost < 100", Map.of("cost", "42")));
        }

        @Test
        void quotedStringLiteral() {
            assertEquals(RuleConditionStatus.SATISFIED, eval("branch == 'main'", Map.of("branch", "main")));
            assertEquals(RuleConditionStatus.VIOLATED, eval("branch != \"main\"", Map.of("branch", "main")));
        }

        @Test
        void orderingOnNonNumber_isIndeterminate() {
            assertEquals(RuleConditionStatus.INDETERMINATE, eval("coverage > 80", Map.of("coverage", "high")));
        }

        @Test
        void dottedPath_readsNestedMaps() {
            assertEquals(RuleConditionStatus.SATISFIED,
                eval("review.approvals >= 2", Map.of("review", Map.of("approvals", 3))));
        }
    }

    @Nested
    @DisplayName("Three-valued logic")
    class ThreeValued {

        @Test
        void absentKey_isIndeterminate() {
            assertEquals(RuleConditionStatus.INDETERMINATE, eval("linted === true", Map.of()));
        }

        @Test
        void falseConjunct_decidesDespiteUnknown() {
            assertEquals(RuleConditionStatus.VIOLATED, eval("linted && coverage >= 80", Map.of("linted", false)));
        }

        @Test
        void trueDisjunct_decidesDespiteUnknown() {
            assertEquals(RuleConditionStatus.SATISFIED, eval("approved || coverage >= 80", Map.of("approved", true)));
        }

        @Test
        void andBindsTighterThanOr() {
            Map<String, Object> params = Map.of("a", false, "b", true, "c", true);
            assertEquals(RuleConditionStatus.SATISFIED, eval("a && b || c", params));
        }

        @Test
        void environment_consultedWhenParameterAbsent() {
            RuleCondition condition = RuleCondition.compile("severity != 'critical'");
            assertEquals(RuleConditionStatus.VIOLATED,
                condition.evaluate(Map.of(), Map.of("severity", "critical")));
        }

        @Test
        void negatedBarePath() {
            assertEquals(RuleConditionStatus.SATISFIED, eval("!forcePushed", Map.of("forcePushed", false)));
        }
    }

    @Nested
    @DisplayName("Compilation")
    class Compilation {

        @Test
        void blank_isEmptyAndIndeterminate() {
            RuleCondition condition = RuleCondition.compile("  ");
            assertTrue(condition.isEmpty());
            assertEquals(RuleConditionStatus.INDETERMINATE, condition.evaluate(Map.of(), Map.of()));
        }

        @Test
        void parentheses_rejected() {
            assertThrows(ContractViolationException.class, () -> RuleCondition.compile("(a && b) || c"));
        }

        @Test
        void operatorsInsideQuotedLiterals_stayInTheLiteral() {
            String expression = "title === 'fix && ship' || owner == \"a||b\" && note != '(draft)'";
            RuleCondition condition = RuleCondition.compile(expression);

            assertEquals(List.of("title", "owner", "note"), List.copyOf(condition.referencedPaths()));
            assertEquals(RuleConditionStatus.SATISFIED,
                condition.evaluate(Map.of("title", "fix && ship"), Map.of()));
            assertEquals(RuleConditionStatus.SATISFIED,
                condition.evaluate(Map.of("title", "fix", "owner", "a||b", "note", "final"), Map.of()));
            assertEquals(RuleConditionStatus.VIOLATED,
                condition.evaluate(Map.of("title", "fix", "owner", "a", "note", "final"), Map.of()));
        }

        @Test
        void unterminatedQuote_rejected() {
            assertThrows(ContractViolationException.class, () -> RuleCondition.compile("branch == 'main"));
        }

        @Test
        void garbageClause_rejected() {
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> RuleCondition.compile("linted === true && 42 is the answer"));
            assertTrue(ex.getMessage().contains("42 is the answer"));
        }

        @Test
        void referencedPaths_inOrder() {
            assertEquals(List.of("linted", "coverage"),
                List.copyOf(RuleCondition.compile("linted && coverage > 1 || linted").referencedPaths()));
        }
    }
}
