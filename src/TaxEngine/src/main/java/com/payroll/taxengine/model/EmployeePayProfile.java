package com.payroll.taxengine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Pay and W-4 data owned by the external employee record. For salaried employees
 * {@code baseRate} is the amount paid per pay period; for hourly employees it is the
 * hourly rate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmployeePayProfile {

    @JsonProperty("employee_id")
    private String employeeId;

    @JsonProperty("pay_type")
    private PayType payType;

    @JsonProperty("base_rate")
    private BigDecimal baseRate = BigDecimal.ZERO;

    @JsonProperty("standard_hours")
    private BigDecimal standardHours;

    @JsonProperty("filing_status")
    private String filingStatus;

    @JsonProperty("pay_frequency")
    private String payFrequency;

    @JsonProperty("w4_other_income")
    private BigDecimal w4OtherIncome = BigDecimal.ZERO;

    @JsonProperty("w4_deductions")
    private BigDecimal w4Deductions = BigDecimal.ZERO;

    @JsonProperty("w4_dependents_credit")
    private BigDecimal w4DependentsCredit = BigDecimal.ZERO;

    @JsonProperty("w4_extra_withholding")
    private BigDecimal w4ExtraWithholding = BigDecimal.ZERO;

    public EmployeePayProfile() {}

    public EmployeePayProfile(String employeeId, PayType payType, BigDecimal baseRate,
                              String filingStatus, String payFrequency) {
        this.employeeId = employeeId;
        this.payType = payType;
        this.baseRate = baseRate;
        this.filingStatus = filingStatus;
        this.payFrequency = payFrequency;
    }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public PayType getPayType() { return payType; }
    public void setPayType(PayType payType) { this.payType = payType; }

    public BigDecimal getBaseRate() { return baseRate; }
    public void setBaseRate(BigDecimal baseRate) { this.baseRate = baseRate; }

    public BigDecimal getStandardHours() { return standardHours; }
    public void setStandardHours(BigDecimal standardHours) { this.standardHours = standardHours; }

    public String getFilingStatus() { return filingStatus; }
    public void setFilingStatus(String filingStatus) { this.filingStatus = filingStatus; }

    public String getPayFrequency() { return payFrequency; }
    public void setPayFrequency(String payFrequency) { this.payFrequency = payFrequency; }

    public BigDecimal getW4OtherIncome() { return w4OtherIncome; }
    public void setW4OtherIncome(BigDecimal w4OtherIncome) { this.w4OtherIncome = w4OtherIncome; }

    public BigDecimal getW4Deductions() { return w4Deductions; }
    public void setW4Deductions(BigDecimal w4Deductions) { this.w4Deductions = w4Deductions; }

    public BigDecimal getW4DependentsCredit() { return w4DependentsCredit; }
    public void setW4DependentsCredit(BigDecimal w4DependentsCredit) { this.w4DependentsCredit = w4DependentsCredit; }

    public BigDecimal getW4ExtraWithholding() { return w4ExtraWithholding; }
    public void setW4ExtraWithholding(BigDecimal w4ExtraWithholding) { this.w4ExtraWithholding = w4ExtraWithholding; }
}
