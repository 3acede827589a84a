package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Amounts withheld from the employee.
 */
public final class EmployeeTaxes {

    @JsonProperty("federal_income_tax")
    private final BigDecimal federalIncomeTax;

    @JsonProperty("social_security")
    private final BigDecimal socialSecurity;

    @JsonProperty("medicare")
    private final BigDecimal medicare;

    @JsonProperty("additional_medicare")
    private final BigDecimal additionalMedicare;

    @JsonCreator
    public EmployeeTaxes(@JsonProperty("federal_income_tax") BigDecimal federalIncomeTax,
                         @JsonProperty("social_security") BigDecimal socialSecurity,
                         @JsonProperty("medicare") BigDecimal medicare,
                         @JsonProperty("additional_medicare") BigDecimal additionalMedicare) {
        this.federalIncomeTax = Objects.requireNonNull(federalIncomeTax, "federalIncomeTax");
        this.socialSecurity = Objects.requireNonNull(socialSecurity, "socialSecurity");
        this.medicare = Objects.requireNonNull(medicare, "medicare");
        this.additionalMedicare = Objects.requireNonNull(additionalMedicare, "additionalMedicare");
    }

    public BigDecimal getFederalIncomeTax() { return federalIncomeTax; }
    public BigDecimal getSocialSecurity() { return socialSecurity; }
    public BigDecimal getMedicare() { return medicare; }
    public BigDecimal getAdditionalMedicare() { return additionalMedicare; }

    /** Sum of all employee withholding. */
    public BigDecimal total() {
        return federalIncomeTax.add(socialSecurity).add(medicare).add(additionalMedicare);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmployeeTaxes)) return false;
        EmployeeTaxes that = (EmployeeTaxes) o;
        return federalIncomeTax.equals(that.federalIncomeTax)
            && socialSecurity.equals(that.socialSecurity)
            && medicare.equals(that.medicare)
            && additionalMedicare.equals(that.additionalMedicare);
    }

    @Override
    public int hashCode() {
        return Objects.hash(federalIncomeTax, socialSecurity, medicare, additionalMedicare);
    }
}
