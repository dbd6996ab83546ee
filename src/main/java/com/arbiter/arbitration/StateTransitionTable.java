package com.arbiter.arbitration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.arbiter.arbitration.ArbitrationState.APPEAL_REVIEW;
import static com.arbiter.arbitration.ArbitrationState.COMPLETED;
import static com.arbiter.arbitration.ArbitrationState.DEBATE_IN_PROGRESS;
import static com.arbiter.arbitration.ArbitrationState.EVIDENCE_COLLECTION;
import static com.arbiter.arbitration.ArbitrationState.FAILED;
import static com.arbiter.arbitration.ArbitrationState.INITIALIZED;
import static com.arbiter.arbitration.ArbitrationState.RULE_EVALUATION;
import static com.arbiter.arbitration.ArbitrationState.VERDICT_GENERATION;
import static com.arbiter.arbitration.ArbitrationState.WAIVER_EVALUATION;

/**
 * Legal session state transitions. Besides the explicit edges, every
 * non-terminal state may move to COMPLETED or FAILED. FAILED is final.
 */
public final class StateTransitionTable {

    private static final Map<ArbitrationState, Set<ArbitrationState>> EDGES = new EnumMap<>(ArbitrationState.class);

    static {
        EDGES.put(INITIALIZED, EnumSet.of(RULE_EVALUATION));
        EDGES.put(RULE_EVALUATION, EnumSet.of(EVIDENCE_COLLECTION, VERDICT_GENERATION));
        EDGES.put(EVIDENCE_COLLECTION, EnumSet.of(VERDICT_GENERATION));
        EDGES.put(VERDICT_GENERATION, EnumSet.of(WAIVER_EVALUATION, APPEAL_REVIEW, COMPLETED));
        EDGES.put(WAIVER_EVALUATION, EnumSet.of(COMPLETED));
        EDGES.put(APPEAL_REVIEW, EnumSet.of(COMPLETED));
        EDGES.put(DEBATE_IN_PROGRESS, EnumSet.of(VERDICT_GENERATION));
        EDGES.put(COMPLETED, EnumSet.of(APPEAL_REVIEW));
        EDGES.put(FAILED, EnumSet.noneOf(ArbitrationState.class));
    }

    private StateTransitionTable() {
    }

    public static boolean isAllowed(ArbitrationState from, ArbitrationState to) {
        if (!from.isTerminal() && (to == COMPLETED || to == FAILED)) {
            return true;
        }
        return EDGES.get(from).contains(to);
    }

    public static Set<ArbitrationState> allowedFrom(ArbitrationState from) {
        Set<ArbitrationState> allowed = EnumSet.noneOf(ArbitrationState.class);
        allowed.addAll(EDGES.get(from));
        if (!from.isTerminal()) {
            allowed.add(COMPLETED);
            allowed.add(FAILED);
        }
        return Collections.unmodifiableSet(allowed);
    }

    /**
     * @throws ArbitrationException with INVALID_STATE_TRANSITION when the edge is not in the table
     */
    public static void validate(ArbitrationState from, ArbitrationState to, String sessionId) {
        if (!isAllowed(from, to)) {
            throw new ArbitrationException(ArbitrationErrorCode.INVALID_STATE_TRANSITION,
                "Invalid state transition from " + from + " to " + to, sessionId);
        }
    }
}
