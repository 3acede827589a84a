package com.payroll.taxengine.report;

import com.payroll.taxengine.error.InconsistentRateAcrossPeriodException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.TreeSet;
import java.util.function.Function;

public final class RateConsistency {

    private RateConsistency() {}

    /**
     * The one rate every row was computed with, or null for an empty row set. Rates are
     * compared numerically, so 0.062 and 0.0620 count as the same rate.
     */
    public static BigDecimal single(String field, Collection<PayrollLedgerRow> rows,
                                    Function<PayrollLedgerRow, BigDecimal> rate) {
        TreeSet<BigDecimal> distinct = new TreeSet<>();
        for (PayrollLedgerRow row : rows) {
            distinct.add(rate.apply(row));
        }
        if (distinct.size() > 1) {
            throw new InconsistentRateAcrossPeriodException(field, distinct);
        }
        return distinct.isEmpty() ? null : distinct.first();
    }
}
