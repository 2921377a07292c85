package com.example.owlmon.monitoring;

/**
 * Output of a monitor for the trace read so far.
 */
public enum Verdict {
    /** Every continuation of the trace satisfies the formula. */
    TRUE,
    /** No continuation of the trace satisfies the formula. */
    FALSE,
    /** Both outcomes are still possible. */
    UNDECIDED
}
