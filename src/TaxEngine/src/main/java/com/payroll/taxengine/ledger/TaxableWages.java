package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Wages subject to each tax for this period, after wage-base caps and thresholds.
 */
public final class TaxableWages {

    @JsonProperty("social_security")
    private final BigDecimal socialSecurity;

    @JsonProperty("medicare")
    private final BigDecimal medicare;

    @JsonProperty("additional_medicare")
    private final BigDecimal additionalMedicare;

    @JsonProperty("futa")
    private final BigDecimal futa;

    @JsonProperty("suta")
    private final BigDecimal suta;

    @JsonCreator
    public TaxableWages(@JsonProperty("social_security") BigDecimal socialSecurity,
                        @JsonProperty("medicare") BigDecimal medicare,
                        @JsonProperty("additional_medicare") BigDecimal additionalMedicare,
                        @JsonProperty("futa") BigDecimal futa,
                        @JsonProperty("suta") BigDecimal suta) {
        this.socialSecurity = Objects.requireNonNull(socialSecurity, "socialSecurity");
        this.medicare = Objects.requireNonNull(medicare, "medicare");
        this.additionalMedicare = Objects.requireNonNull(additionalMedicare, "additionalMedicare");
        this.futa = Objects.requireNonNull(futa, "futa");
        this.suta = Objects.requireNonNull(suta, "suta");
    }

    public BigDecimal getSocialSecurity() { return socialSecurity; }
    public BigDecimal getMedicare() { return medicare; }
    public BigDecimal getAdditionalMedicare() { return additionalMedicare; }
    public BigDecimal getFuta() { return futa; }
    public BigDecimal getSuta() { return suta; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaxableWages)) return false;
        TaxableWages that = (TaxableWages) o;
        return socialSecurity.equals(that.socialSecurity)
            && medicare.equals(that.medicare)
            && additionalMedicare.equals(that.additionalMedicare)
            && futa.equals(that.futa)
            && suta.equals(that.suta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(socialSecurity, medicare, additionalMedicare, futa, suta);
    }
}
