package com.payroll.taxengine.error;

import java.math.BigDecimal;

public class NegativeInputRejectedException extends PayrollTaxException {

    public NegativeInputRejectedException(String field, BigDecimal value) {
        super(ErrorKind.NEGATIVE_INPUT_REJECTED, field,
            field + " must not be negative (was " + value.toPlainString() + ")");
    }
}
