package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Per-employee wage line of an RT-6 or 940 detail listing. Taxable wages repeat the
 * capped figures stored on the ledger rows.
 */
@JsonPropertyOrder({"employee_id", "gross_wages", "taxable_wages", "excess_wages"})
public final class EmployeeWageDetail {

    @JsonProperty("employee_id")
    private final String employeeId;

    @JsonProperty("gross_wages")
    private final BigDecimal grossWages;

    @JsonProperty("taxable_wages")
    private final BigDecimal taxableWages;

    @JsonProperty("excess_wages")
    private final BigDecimal excessWages;

    public EmployeeWageDetail(String employeeId, BigDecimal grossWages, BigDecimal taxableWages) {
        this.employeeId = employeeId;
        this.grossWages = grossWages;
        this.taxableWages = taxableWages;
        this.excessWages = grossWages.subtract(taxableWages);
    }

    public String getEmployeeId() { return employeeId; }
    public BigDecimal getGrossWages() { return grossWages; }
    public BigDecimal getTaxableWages() { return taxableWages; }
    public BigDecimal getExcessWages() { return excessWages; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmployeeWageDetail)) return false;
        EmployeeWageDetail that = (EmployeeWageDetail) o;
        return employeeId.equals(that.employeeId)
            && grossWages.equals(that.grossWages)
            && taxableWages.equals(that.taxableWages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(employeeId, grossWages, taxableWages);
    }
}
