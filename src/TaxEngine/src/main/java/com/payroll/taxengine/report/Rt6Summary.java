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
 * Florida RT-6 reemployment tax totals for one company quarter. {@code taxDue} is the flat
 * multiply of the quarter's taxable wages by the company rate; {@code ledgerContributions}
 * is the sum of the per-row SUTA amounts, which can differ from it by rounding cents.
 */
@JsonPropertyOrder({"company_id", "year", "quarter", "suta_rate", "gross_wages", "excess_wages",
    "taxable_wages", "tax_due", "ledger_contributions", "employee_detail", "line_items"})
public final class Rt6Summary {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("quarter")
    private final int quarter;

    @JsonProperty("suta_rate")
    private final BigDecimal sutaRate;

    @JsonProperty("gross_wages")
    private final BigDecimal grossWages;

    @JsonProperty("excess_wages")
    private final BigDecimal excessWages;

    @JsonProperty("taxable_wages")
    private final BigDecimal taxableWages;

    @JsonProperty("tax_due")
    private final BigDecimal taxDue;

    @JsonProperty("ledger_contributions")
    private final BigDecimal ledgerContributions;

    @JsonProperty("employee_detail")
    private final List<EmployeeWageDetail> employeeDetail;

    public Rt6Summary(String companyId, int year, int quarter, BigDecimal sutaRate, BigDecimal grossWages,
                      BigDecimal taxableWages, BigDecimal taxDue, BigDecimal ledgerContributions,
                      List<EmployeeWageDetail> employeeDetail) {
        this.companyId = companyId;
        this.year = year;
        this.quarter = quarter;
        this.sutaRate = sutaRate;
        this.grossWages = grossWages;
        this.taxableWages = taxableWages;
        this.excessWages = grossWages.subtract(taxableWages);
        this.taxDue = taxDue;
        this.ledgerContributions = ledgerContributions;
        this.employeeDetail = List.copyOf(employeeDetail);
    }

    public String getCompanyId() { return companyId; }
    public int getYear() { return year; }
    public int getQuarter() { return quarter; }
    public BigDecimal getSutaRate() { return sutaRate; }
    public BigDecimal getGrossWages() { return grossWages; }
    public BigDecimal getExcessWages() { return excessWages; }
    public BigDecimal getTaxableWages() { return taxableWages; }
    public BigDecimal getTaxDue() { return taxDue; }
    public BigDecimal getLedgerContributions() { return ledgerContributions; }
    public List<EmployeeWageDetail> getEmployeeDetail() { return employeeDetail; }

    @JsonProperty("line_items")
    public Map<String, BigDecimal> getLineItems() {
        Map<String, BigDecimal> lines = new LinkedHashMap<>();
        lines.put("line_2_gross_wages", grossWages);
        lines.put("line_3_excess_wages", excessWages);
        lines.put("line_4_taxable_wages", taxableWages);
        lines.put("line_5_tax_due", taxDue);
        return Collections.unmodifiableMap(lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rt6Summary)) return false;
        Rt6Summary that = (Rt6Summary) o;
        return year == that.year && quarter == that.quarter
            && Objects.equals(companyId, that.companyId)
            && Objects.equals(sutaRate, that.sutaRate)
            && grossWages.equals(that.grossWages)
            && taxableWages.equals(that.taxableWages)
            && taxDue.equals(that.taxDue)
            && ledgerContributions.equals(that.ledgerContributions)
            && employeeDetail.equals(that.employeeDetail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(companyId, year, quarter, grossWages, taxableWages, taxDue);
    }
}
