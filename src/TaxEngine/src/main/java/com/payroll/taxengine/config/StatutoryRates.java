package com.payroll.taxengine.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Year-level FICA, FUTA and Florida reemployment parameters. Stamped into every ledger
 * row so reports can detect rows computed under different parameters.
 */
public final class StatutoryRates {

    @JsonProperty("social_security_employee_rate")
    private final BigDecimal socialSecurityEmployeeRate;

    @JsonProperty("social_security_employer_rate")
    private final BigDecimal socialSecurityEmployerRate;

    @JsonProperty("social_security_wage_base")
    private final BigDecimal socialSecurityWageBase;

    @JsonProperty("medicare_employee_rate")
    private final BigDecimal medicareEmployeeRate;

    @JsonProperty("medicare_employer_rate")
    private final BigDecimal medicareEmployerRate;

    @JsonProperty("additional_medicare_rate")
    private final BigDecimal additionalMedicareRate;

    @JsonProperty("additional_medicare_threshold")
    private final BigDecimal additionalMedicareThreshold;

    @JsonProperty("futa_rate")
    private final BigDecimal futaRate;

    @JsonProperty("futa_wage_base")
    private final BigDecimal futaWageBase;

    @JsonProperty("suta_wage_base")
    private final BigDecimal sutaWageBase;

    @JsonCreator
    public StatutoryRates(
            @JsonProperty("social_security_employee_rate") BigDecimal socialSecurityEmployeeRate,
            @JsonProperty("social_security_employer_rate") BigDecimal socialSecurityEmployerRate,
            @JsonProperty("social_security_wage_base") BigDecimal socialSecurityWageBase,
            @JsonProperty("medicare_employee_rate") BigDecimal medicareEmployeeRate,
            @JsonProperty("medicare_employer_rate") BigDecimal medicareEmployerRate,
            @JsonProperty("additional_medicare_rate") BigDecimal additionalMedicareRate,
            @JsonProperty("additional_medicare_threshold") BigDecimal additionalMedicareThreshold,
            @JsonProperty("futa_rate") BigDecimal futaRate,
            @JsonProperty("futa_wage_base") BigDecimal futaWageBase,
            @JsonProperty("suta_wage_base") BigDecimal sutaWageBase) {
        this.socialSecurityEmployeeRate = Objects.requireNonNull(socialSecurityEmployeeRate);
        this.socialSecurityEmployerRate = Objects.requireNonNull(socialSecurityEmployerRate);
        this.socialSecurityWageBase = Objects.requireNonNull(socialSecurityWageBase);
        this.medicareEmployeeRate = Objects.requireNonNull(medicareEmployeeRate);
        this.medicareEmployerRate = Objects.requireNonNull(medicareEmployerRate);
        this.additionalMedicareRate = Objects.requireNonNull(additionalMedicareRate);
        this.additionalMedicareThreshold = Objects.requireNonNull(additionalMedicareThreshold);
        this.futaRate = Objects.requireNonNull(futaRate);
        this.futaWageBase = Objects.requireNonNull(futaWageBase);
        this.sutaWageBase = Objects.requireNonNull(sutaWageBase);
    }

    public BigDecimal getSocialSecurityEmployeeRate() { return socialSecurityEmployeeRate; }
    public BigDecimal getSocialSecurityEmployerRate() { return socialSecurityEmployerRate; }
    public BigDecimal getSocialSecurityWageBase() { return socialSecurityWageBase; }
    public BigDecimal getMedicareEmployeeRate() { return medicareEmployeeRate; }
    public BigDecimal getMedicareEmployerRate() { return medicareEmployerRate; }
    public BigDecimal getAdditionalMedicareRate() { return additionalMedicareRate; }
    public BigDecimal getAdditionalMedicareThreshold() { return additionalMedicareThreshold; }
    public BigDecimal getFutaRate() { return futaRate; }
    public BigDecimal getFutaWageBase() { return futaWageBase; }
    public BigDecimal getSutaWageBase() { return sutaWageBase; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatutoryRates)) return false;
        StatutoryRates that = (StatutoryRates) o;
        return socialSecurityEmployeeRate.equals(that.socialSecurityEmployeeRate)
            && socialSecurityEmployerRate.equals(that.socialSecurityEmployerRate)
            && socialSecurityWageBase.equals(that.socialSecurityWageBase)
            && medicareEmployeeRate.equals(that.medicareEmployeeRate)
            && medicareEmployerRate.equals(that.medicareEmployerRate)
            && additionalMedicareRate.equals(that.additionalMedicareRate)
            && additionalMedicareThreshold.equals(that.additionalMedicareThreshold)
            && futaRate.equals(that.futaRate)
            && futaWageBase.equals(that.futaWageBase)
            && sutaWageBase.equals(that.sutaWageBase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(socialSecurityEmployeeRate, socialSecurityEmployerRate, socialSecurityWageBase,
            medicareEmployeeRate, medicareEmployerRate, additionalMedicareRate, additionalMedicareThreshold,
            futaRate, futaWageBase, sutaWageBase);
    }
}
