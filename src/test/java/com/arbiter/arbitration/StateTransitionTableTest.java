package com.arbiter.arbitration;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static com.arbiter.arbitration.ArbitrationState.*;
import static org.junit.jupiter.api.Assertions.*;

class StateTransitionTableTest {

    @Test
    void explicitEdges_areAllowed() {
        assertTrue(StateTransitionTable.isAllowed(INITIALIZED, RULE_EVALUATION));
        assertTrue(StateTransitionTable.isAllowed(RULE_EVALUATION, EVIDENCE_COLLECTION));
        assertTrue(StateTransitionTable.isAllowed(RULE_EVALUATION, VERDICT_GENERATION));
        assertTrue(StateTransitionTable.isAllowed(EVIDENCE_COLLECTION, VERDICT_GENERATION));
        assertTrue(StateTransitionTable.isAllowed(VERDICT_GENERATION, WAIVER_EVALUATION));
        assertTrue(StateTransitionTable.isAllowed(VERDICT_GENERATION, APPEAL_REVIEW));
        assertTrue(StateTransitionTable.isAllowed(DEBATE_IN_PROGRESS, VERDICT_GENERATION));
        assertTrue(StateTransitionTable.isAllowed(COMPLETED, APPEAL_REVIEW));
    }

    @Test
    void everyNonTerminalState_canCompleteOrFail() {
        for (ArbitrationState state : ArbitrationState.values()) {
            if (state.isTerminal()) {
                continue;
            }
            assertTrue(StateTransitionTable.isAllowed(state, COMPLETED), state + " -> COMPLETED");
            assertTrue(StateTransitionTable.isAllowed(state, FAILED), state + " -> FAILED");
        }
    }

    @Test
    void failed_isFinal() {
        assertTrue(StateTransitionTable.allowedFrom(FAILED).isEmpty());
        for (ArbitrationState state : ArbitrationState.values()) {
            assertFalse(StateTransitionTable.isAllowed(FAILED, state));
        }
    }

    @Test
    void completed_onlyReopensForAppeal() {
        assertEquals(EnumSet.of(APPEAL_REVIEW), StateTransitionTable.allowedFrom(COMPLETED));
        assertFalse(StateTransitionTable.isAllowed(COMPLETED, FAILED));
    }

    @Test
    void backwardEdges_rejected() {
        assertFalse(StateTransitionTable.isAllowed(VERDICT_GENERATION, RULE_EVALUATION));
        assertFalse(StateTransitionTable.isAllowed(RULE_EVALUATION, WAIVER_EVALUATION));
        assertFalse(StateTransitionTable.isAllowed(APPEAL_REVIEW, WAIVER_EVALUATION));

        ArbitrationException ex = assertThrows(ArbitrationException.class,
            () -> StateTransitionTable.validate(WAIVER_EVALUATION, APPEAL_REVIEW, "ARB-1"));
        assertEquals(ArbitrationErrorCode.INVALID_STATE_TRANSITION, ex.getCode());
        assertEquals("ARB-1", ex.getSessionId().orElseThrow());
    }
}
