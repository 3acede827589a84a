package com.payroll.taxengine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One payroll run for one employee. {@code year} and {@code month} default to the pay
 * date's; hours default to the profile's standard hours.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayrollRunInput {

    @JsonProperty("pay_date")
    private LocalDate payDate;

    @JsonProperty("year")
    private Integer year;

    @JsonProperty("month")
    private Integer month;

    @JsonProperty("hours_worked")
    private BigDecimal hoursWorked;

    @JsonProperty("bonus")
    private BigDecimal bonus = BigDecimal.ZERO;

    @JsonProperty("reimbursements")
    private BigDecimal reimbursements = BigDecimal.ZERO;

    @JsonProperty("other_deductions")
    private BigDecimal otherDeductions = BigDecimal.ZERO;

    public PayrollRunInput() {}

    public PayrollRunInput(LocalDate payDate) {
        this.payDate = payDate;
    }

    public LocalDate getPayDate() { return payDate; }
    public void setPayDate(LocalDate payDate) { this.payDate = payDate; }

    public Integer getYear() { return year; }
    public void setYear(Integer year) { this.year = year; }

    public Integer getMonth() { return month; }
    public void setMonth(Integer month) { this.month = month; }

    public BigDecimal getHoursWorked() { return hoursWorked; }
    public void setHoursWorked(BigDecimal hoursWorked) { this.hoursWorked = hoursWorked; }

    public BigDecimal getBonus() { return bonus; }
    public void setBonus(BigDecimal bonus) { this.bonus = bonus; }

    public BigDecimal getReimbursements() { return reimbursements; }
    public void setReimbursements(BigDecimal reimbursements) { this.reimbursements = reimbursements; }

    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public void setOtherDeductions(BigDecimal otherDeductions) { this.otherDeductions = otherDeductions; }

    /** Tax year of the run: the explicit year, else the pay date's. */
    public int effectiveYear() {
        return year != null ? year : payDate.getYear();
    }

    /** Month of the run: the explicit month, else the pay date's. */
    public int effectiveMonth() {
        return month != null ? month : payDate.getMonthValue();
    }
}
