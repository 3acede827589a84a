package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Federal Form 940 totals for one company year. Warnings list employees whose summed FUTA
 * taxable wages exceed the wage base, which means a row was computed with a wrong prior
 * year-to-date figure.
 */
@JsonPropertyOrder({"company_id", "year", "futa_rate", "futa_wage_base", "total_payments", "excess_payments",
    "futa_taxable_wages", "futa_tax", "ledger_futa_tax", "employee_detail", "warnings", "line_items"})
public final class Form940Summary {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("futa_rate")
    private final BigDecimal futaRate;

    @JsonProperty("futa_wage_base")
    private final BigDecimal futaWageBase;

    @JsonProperty("total_payments")
    private final BigDecimal totalPayments;

    @JsonProperty("excess_payments")
    private final BigDecimal excessPayments;

    @JsonProperty("futa_taxable_wages")
    private final BigDecimal futaTaxableWages;

    @JsonProperty("futa_tax")
    private final BigDecimal futaTax;

    @JsonProperty("ledger_futa_tax")
    private final BigDecimal ledgerFutaTax;

    @JsonProperty("employee_detail")
    private final List<EmployeeWageDetail> employeeDetail;

    @JsonProperty("warnings")
    private final List<String> warnings;

    public Form940Summary(String companyId, int year, BigDecimal futaRate, BigDecimal futaWageBase,
                          BigDecimal totalPayments, BigDecimal futaTaxableWages, BigDecimal futaTax,
                          BigDecimal ledgerFutaTax, List<EmployeeWageDetail> employeeDetail, List<String> warnings) {
        this.companyId = companyId;
        this.year = year;
        this.futaRate = futaRate;
        this.futaWageBase = futaWageBase;
        this.totalPayments = totalPayments;
        this.futaTaxableWages = futaTaxableWages;
        this.excessPayments = totalPayments.subtract(futaTaxableWages);
        this.futaTax = futaTax;
        this.ledgerFutaTax = ledgerFutaTax;
        this.employeeDetail = List.copyOf(employeeDetail);
        this.warnings = List.copyOf(warnings);
    }

    public String getCompanyId() { return companyId; }
    public int getYear() { return year; }
    public BigDecimal getFutaRate() { return futaRate; }
    public BigDecimal getFutaWageBase() { return futaWageBase; }
    public BigDecimal getTotalPayments() { return totalPayments; }
    public BigDecimal getExcessPayments() { return excessPayments; }
    public BigDecimal getFutaTaxableWages() { return futaTaxableWages; }
    public BigDecimal getFutaTax() { return futaTax; }
    public BigDecimal getLedgerFutaTax() { return ledgerFutaTax; }
    public List<EmployeeWageDetail> getEmployeeDetail() { return employeeDetail; }
    public List<String> getWarnings() { return warnings; }

    @JsonProperty("line_items")
    public Map<String, BigDecimal> getLineItems() {
        Map<String, BigDecimal> lines = new LinkedHashMap<>();
        lines.put("line_3_total_payments", totalPayments);
        lines.put("line_5_payments_over_wage_base", excessPayments);
        lines.put("line_7_futa_taxable_wages", futaTaxableWages);
        lines.put("line_8_futa_tax_before_adjustments", futaTax);
        return Collections.unmodifiableMap(lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Form940Summary)) return false;
        Form940Summary that = (Form940Summary) o;
        return year == that.year
            && Objects.equals(companyId, that.companyId)
            && Objects.equals(futaRate, that.futaRate)
            && Objects.equals(futaWageBase, that.futaWageBase)
            && totalPayments.equals(that.totalPayments)
            && futaTaxableWages.equals(that.futaTaxableWages)
            && futaTax.equals(that.futaTax)
            && ledgerFutaTax.equals(that.ledgerFutaTax)
            && employeeDetail.equals(that.employeeDetail)
            && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(companyId, year, totalPayments, futaTaxableWages, futaTax);
    }
}
