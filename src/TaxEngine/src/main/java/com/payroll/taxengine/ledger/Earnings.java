package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Gross pay and its components for one period.
 */
public final class Earnings {

    @JsonProperty("regular_pay")
    private final BigDecimal regularPay;

    @JsonProperty("bonus")
    private final BigDecimal bonus;

    @JsonProperty("reimbursements")
    private final BigDecimal reimbursements;

    @JsonProperty("gross_pay")
    private final BigDecimal grossPay;

    @JsonCreator
    public Earnings(@JsonProperty("regular_pay") BigDecimal regularPay,
                    @JsonProperty("bonus") BigDecimal bonus,
                    @JsonProperty("reimbursements") BigDecimal reimbursements,
                    @JsonProperty("gross_pay") BigDecimal grossPay) {
        this.regularPay = Objects.requireNonNull(regularPay, "regularPay");
        this.bonus = Objects.requireNonNull(bonus, "bonus");
        this.reimbursements = Objects.requireNonNull(reimbursements, "reimbursements");
        this.grossPay = Objects.requireNonNull(grossPay, "grossPay");
    }

    public BigDecimal getRegularPay() { return regularPay; }
    public BigDecimal getBonus() { return bonus; }
    public BigDecimal getReimbursements() { return reimbursements; }
    public BigDecimal getGrossPay() { return grossPay; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Earnings)) return false;
        Earnings that = (Earnings) o;
        return regularPay.equals(that.regularPay)
            && bonus.equals(that.bonus)
            && reimbursements.equals(that.reimbursements)
            && grossPay.equals(that.grossPay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regularPay, bonus, reimbursements, grossPay);
    }
}
