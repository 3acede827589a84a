package com.payroll.taxengine.ledger;

/**
 * Rounding decision recorded on a trace entry.
 */
public enum RoundingApplied {
    /** Exact value, nothing dropped. */
    NONE,
    /** Division carried to ten fractional digits, HALF_UP. */
    HALF_UP_INTERMEDIATE,
    /** Rounded to cents, HALF_UP. */
    HALF_UP_CENTS
}
