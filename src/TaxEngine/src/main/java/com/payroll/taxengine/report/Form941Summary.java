package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Federal Form 941 totals for one company quarter.
 */
@JsonPropertyOrder({"company_id", "year", "quarter", "employee_count", "wages", "federal_income_tax_withheld",
    "social_security_wages", "social_security_tax", "medicare_wages", "medicare_tax",
    "additional_medicare_wages", "additional_medicare_withheld", "total_social_security_medicare_tax",
    "total_tax", "line_items"})
public final class Form941Summary {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("quarter")
    private final int quarter;

    @JsonProperty("employee_count")
    private final int employeeCount;

    @JsonProperty("wages")
    private final BigDecimal wages;

    @JsonProperty("federal_income_tax_withheld")
    private final BigDecimal federalIncomeTaxWithheld;

    @JsonProperty("social_security_wages")
    private final BigDecimal socialSecurityWages;

    /** Employee plus employer share. */
    @JsonProperty("social_security_tax")
    private final BigDecimal socialSecurityTax;

    @JsonProperty("medicare_wages")
    private final BigDecimal medicareWages;

    /** Employee plus employer share. */
    @JsonProperty("medicare_tax")
    private final BigDecimal medicareTax;

    @JsonProperty("additional_medicare_wages")
    private final BigDecimal additionalMedicareWages;

    @JsonProperty("additional_medicare_withheld")
    private final BigDecimal additionalMedicareWithheld;

    public Form941Summary(String companyId, int year, int quarter, int employeeCount, BigDecimal wages,
                          BigDecimal federalIncomeTaxWithheld, BigDecimal socialSecurityWages,
                          BigDecimal socialSecurityTax, BigDecimal medicareWages, BigDecimal medicareTax,
                          BigDecimal additionalMedicareWages, BigDecimal additionalMedicareWithheld) {
        this.companyId = companyId;
        this.year = year;
        this.quarter = quarter;
        this.employeeCount = employeeCount;
        this.wages = wages;
        this.federalIncomeTaxWithheld = federalIncomeTaxWithheld;
        this.socialSecurityWages = socialSecurityWages;
        this.socialSecurityTax = socialSecurityTax;
        this.medicareWages = medicareWages;
        this.medicareTax = medicareTax;
        this.additionalMedicareWages = additionalMedicareWages;
        this.additionalMedicareWithheld = additionalMedicareWithheld;
    }

    public String getCompanyId() { return companyId; }
    public int getYear() { return year; }
    public int getQuarter() { return quarter; }
    public int getEmployeeCount() { return employeeCount; }
    public BigDecimal getWages() { return wages; }
    public BigDecimal getFederalIncomeTaxWithheld() { return federalIncomeTaxWithheld; }
    public BigDecimal getSocialSecurityWages() { return socialSecurityWages; }
    public BigDecimal getSocialSecurityTax() { return socialSecurityTax; }
    public BigDecimal getMedicareWages() { return medicareWages; }
    public BigDecimal getMedicareTax() { return medicareTax; }
    public BigDecimal getAdditionalMedicareWages() { return additionalMedicareWages; }
    public BigDecimal getAdditionalMedicareWithheld() { return additionalMedicareWithheld; }

    /** Line 5e. */
    @JsonProperty("total_social_security_medicare_tax")
    public BigDecimal getTotalSocialSecurityMedicareTax() {
        return socialSecurityTax.add(medicareTax).add(additionalMedicareWithheld);
    }

    /** Line 6, total taxes before adjustments. */
    @JsonProperty("total_tax")
    public BigDecimal getTotalTax() {
        return federalIncomeTaxWithheld.add(getTotalSocialSecurityMedicareTax());
    }

    @JsonProperty("line_items")
    public Map<String, BigDecimal> getLineItems() {
        Map<String, BigDecimal> lines = new LinkedHashMap<>();
        lines.put("line_1_employee_count", BigDecimal.valueOf(employeeCount));
        lines.put("line_2_wages_tips_other_comp", wages);
        lines.put("line_3_federal_income_tax_withheld", federalIncomeTaxWithheld);
        lines.put("line_5a_taxable_social_security_wages", socialSecurityWages);
        lines.put("line_5a_tax_social_security", socialSecurityTax);
        lines.put("line_5c_taxable_medicare_wages_tips", medicareWages);
        lines.put("line_5c_tax_medicare", medicareTax);
        lines.put("line_5d_taxable_wages_additional_medicare", additionalMedicareWages);
        lines.put("line_5d_tax_additional_medicare_withholding", additionalMedicareWithheld);
        lines.put("line_5e_total_social_security_medicare_taxes", getTotalSocialSecurityMedicareTax());
        lines.put("line_6_total_taxes_before_adjustments", getTotalTax());
        return Collections.unmodifiableMap(lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Form941Summary)) return false;
        Form941Summary that = (Form941Summary) o;
        return year == that.year && quarter == that.quarter && employeeCount == that.employeeCount
            && Objects.equals(companyId, that.companyId)
            && wages.equals(that.wages)
            && federalIncomeTaxWithheld.equals(that.federalIncomeTaxWithheld)
            && socialSecurityWages.equals(that.socialSecurityWages)
            && socialSecurityTax.equals(that.socialSecurityTax)
            && medicareWages.equals(that.medicareWages)
            && medicareTax.equals(that.medicareTax)
            && additionalMedicareWages.equals(that.additionalMedicareWages)
            && additionalMedicareWithheld.equals(that.additionalMedicareWithheld);
    }

    @Override
    public int hashCode() {
        return Objects.hash(companyId, year, quarter, wages, federalIncomeTaxWithheld, socialSecurityTax, medicareTax);
    }
}
