package com.payroll.taxengine.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies the tax-year configuration a ledger row was computed under.
 */
public final class ConfigStamp {

    @JsonProperty("tax_year")
    private final int taxYear;

    @JsonProperty("pay_frequency")
    private final String payFrequency;

    @JsonProperty("version")
    private final String version;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("effective_date")
    private final LocalDate effectiveDate;

    @JsonCreator
    public ConfigStamp(@JsonProperty("tax_year") int taxYear,
                       @JsonProperty("pay_frequency") String payFrequency,
                       @JsonProperty("version") String version,
                       @JsonProperty("source") String source,
                       @JsonProperty("effective_date") LocalDate effectiveDate) {
        this.taxYear = taxYear;
        this.payFrequency = payFrequency;
        this.version = version;
        this.source = source;
        this.effectiveDate = effectiveDate;
    }

    public int getTaxYear() { return taxYear; }
    public String getPayFrequency() { return payFrequency; }
    public String getVersion() { return version; }
    public String getSource() { return source; }
    public LocalDate getEffectiveDate() { return effectiveDate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigStamp)) return false;
        ConfigStamp that = (ConfigStamp) o;
        return taxYear == that.taxYear
            && Objects.equals(payFrequency, that.payFrequency)
            && Objects.equals(version, that.version)
            && Objects.equals(source, that.source)
            && Objects.equals(effectiveDate, that.effectiveDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taxYear, payFrequency, version, source, effectiveDate);
    }

    @Override
    public String toString() {
        return taxYear + "/" + payFrequency + " v" + version;
    }
}
