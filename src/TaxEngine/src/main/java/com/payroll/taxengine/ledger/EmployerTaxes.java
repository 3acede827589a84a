package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Employer-side liabilities. Not deducted from net pay.
 */
public final class EmployerTaxes {

    @JsonProperty("social_security")
    private final BigDecimal socialSecurity;

    @JsonProperty("medicare")
    private final BigDecimal medicare;

    @JsonProperty("futa")
    private final BigDecimal futa;

    @JsonProperty("suta")
    private final BigDecimal suta;

    @JsonCreator
    public EmployerTaxes(@JsonProperty("social_security") BigDecimal socialSecurity,
                         @JsonProperty("medicare") BigDecimal medicare,
                         @JsonProperty("futa") BigDecimal futa,
                         @JsonProperty("suta") BigDecimal suta) {
        this.socialSecurity = Objects.requireNonNull(socialSecurity, "socialSecurity");
        this.medicare = Objects.requireNonNull(medicare, "medicare");
        this.futa = Objects.requireNonNull(futa, "futa");
        this.suta = Objects.requireNonNull(suta, "suta");
    }

    public BigDecimal getSocialSecurity() { return socialSecurity; }
    public BigDecimal getMedicare() { return medicare; }
    public BigDecimal getFuta() { return futa; }
    public BigDecimal getSuta() { return suta; }

    public BigDecimal total() {
        return socialSecurity.add(medicare).add(futa).add(suta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmployerTaxes)) return false;
        EmployerTaxes that = (EmployerTaxes) o;
        return socialSecurity.equals(that.socialSecurity)
            && medicare.equals(that.medicare)
            && futa.equals(that.futa)
            && suta.equals(that.suta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(socialSecurity, medicare, futa, suta);
    }
}
