package com.payroll.taxengine.calc;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding policy: HALF_UP to cents on every line item, divisions carried to ten
 * fractional digits before that. Unrounded fractions are never carried forward.
 */
public final class Money {

    public static final int CENTS = 2;
    public static final int INTERMEDIATE_SCALE = 10;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(CENTS);

    private Money() {}

    public static BigDecimal cents(BigDecimal value) {
        return value.setScale(CENTS, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, INTERMEDIATE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal divideToCents(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, CENTS, RoundingMode.HALF_UP);
    }

    public static BigDecimal atLeastZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO.setScale(Math.max(value.scale(), 0)) : value;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
