package com.payroll.taxengine.error;

/**
 * Categories of engine failure. Every kind is recoverable by the caller: the payroll
 * run is rejected and no ledger row is persisted.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND,
    CONFIG_INVALID,
    UNSUPPORTED_FILING_STATUS,
    UNSUPPORTED_FREQUENCY,
    NEGATIVE_INPUT_REJECTED,
    INVALID_INPUT,
    INCONSISTENT_RATE_ACROSS_PERIOD
}
