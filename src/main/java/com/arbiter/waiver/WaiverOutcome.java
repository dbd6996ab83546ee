package com.arbiter.waiver;

/** Graded reading of a waiver decision. */
public enum WaiverOutcome {
    /** Excused in full, as requested. */
    WAIVED,
    /** Excused under conditions or for less time than requested. */
    PARTIALLY_WAIVED,
    DENIED
}
