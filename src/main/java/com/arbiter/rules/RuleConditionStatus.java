package com.arbiter.rules;

public enum RuleConditionStatus {
    /** The compliant-state condition is false for the action. */
    VIOLATED,
    /** The compliant-state condition holds. */
    SATISFIED,
    /** The condition references inputs the action did not provide. */
    INDETERMINATE,
    /** Rule unknown to the engine or not in effect at the action time. */
    NOT_APPLICABLE
}
