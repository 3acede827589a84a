package com.payroll.taxengine.config;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of an annual percentage-method table: wages over {@code over} are taxed at
 * {@code baseTax + rate × (amount − over)}. The bracket runs up to the next bracket's
 * lower bound.
 */
public final class FitBracket {

    private final BigDecimal over;
    private final BigDecimal rate;
    private final BigDecimal baseTax;

    public FitBracket(BigDecimal over, BigDecimal rate, BigDecimal baseTax) {
        this.over = Objects.requireNonNull(over, "over");
        this.rate = Objects.requireNonNull(rate, "rate");
        this.baseTax = Objects.requireNonNull(baseTax, "baseTax");
    }

    public BigDecimal getOver() { return over; }
    public BigDecimal getRate() { return rate; }
    public BigDecimal getBaseTax() { return baseTax; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FitBracket)) return false;
        FitBracket that = (FitBracket) o;
        return over.compareTo(that.over) == 0
            && rate.compareTo(that.rate) == 0
            && baseTax.compareTo(that.baseTax) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(over.stripTrailingZeros(), rate.stripTrailingZeros(), baseTax.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "over " + over.toPlainString() + ": " + baseTax.toPlainString() + " + "
            + rate.toPlainString() + " x excess";
    }
}
