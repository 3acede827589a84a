package com.payroll.taxengine.error;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * A row set spans more than one rate for a figure that can only be derived from a single
 * rate (W-2 wage back-derivation, 940 FUTA tax due).
 */
public class InconsistentRateAcrossPeriodException extends PayrollTaxException {

    public InconsistentRateAcrossPeriodException(String field, Collection<BigDecimal> rates) {
        super(ErrorKind.INCONSISTENT_RATE_ACROSS_PERIOD, field,
            "Rows use more than one " + field + " ("
                + rates.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", "))
                + "); cannot derive a single figure without reconciliation");
    }
}
