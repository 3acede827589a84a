package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.math.BigDecimal;

/**
 * One employee's running totals from January through {@code throughMonth}.
 */
@JsonPropertyOrder({"company_id", "employee_id", "year", "through_month", "pay_periods", "gross_pay",
    "federal_income_tax", "social_security_employee", "medicare_employee", "additional_medicare_employee",
    "social_security_employer", "medicare_employer", "futa", "suta", "other_deductions", "net_pay",
    "social_security_taxable_wages", "medicare_wages", "futa_taxable_wages", "suta_taxable_wages"})
public class YearToDateSummary {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("employee_id")
    private final String employeeId;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("through_month")
    private final int throughMonth;

    @JsonProperty("pay_periods")
    private int payPeriods;

    @JsonProperty("gross_pay")
    private BigDecimal grossPay = BigDecimal.ZERO;

    @JsonProperty("federal_income_tax")
    private BigDecimal federalIncomeTax = BigDecimal.ZERO;

    @JsonProperty("social_security_employee")
    private BigDecimal socialSecurityEmployee = BigDecimal.ZERO;

    @JsonProperty("medicare_employee")
    private BigDecimal medicareEmployee = BigDecimal.ZERO;

    @JsonProperty("additional_medicare_employee")
    private BigDecimal additionalMedicareEmployee = BigDecimal.ZERO;

    @JsonProperty("social_security_employer")
    private BigDecimal socialSecurityEmployer = BigDecimal.ZERO;

    @JsonProperty("medicare_employer")
    private BigDecimal medicareEmployer = BigDecimal.ZERO;

    @JsonProperty("futa")
    private BigDecimal futa = BigDecimal.ZERO;

    @JsonProperty("suta")
    private BigDecimal suta = BigDecimal.ZERO;

    @JsonProperty("other_deductions")
    private BigDecimal otherDeductions = BigDecimal.ZERO;

    @JsonProperty("net_pay")
    private BigDecimal netPay = BigDecimal.ZERO;

    @JsonProperty("social_security_taxable_wages")
    private BigDecimal socialSecurityTaxableWages = BigDecimal.ZERO;

    @JsonProperty("medicare_wages")
    private BigDecimal medicareWages = BigDecimal.ZERO;

    @JsonProperty("futa_taxable_wages")
    private BigDecimal futaTaxableWages = BigDecimal.ZERO;

    @JsonProperty("suta_taxable_wages")
    private BigDecimal sutaTaxableWages = BigDecimal.ZERO;

    YearToDateSummary(String companyId, String employeeId, int year, int throughMonth) {
        this.companyId = companyId;
        this.employeeId = employeeId;
        this.year = year;
        this.throughMonth = throughMonth;
    }

    void add(PayrollLedgerRow row) {
        payPeriods++;
        grossPay = grossPay.add(row.grossPay());
        federalIncomeTax = federalIncomeTax.add(row.getEmployeeTaxes().getFederalIncomeTax());
        socialSecurityEmployee = socialSecurityEmployee.add(row.getEmployeeTaxes().getSocialSecurity());
        medicareEmployee = medicareEmployee.add(row.getEmployeeTaxes().getMedicare());
        additionalMedicareEmployee = additionalMedicareEmployee.add(row.getEmployeeTaxes().getAdditionalMedicare());
        socialSecurityEmployer = socialSecurityEmployer.add(row.getEmployerTaxes().getSocialSecurity());
        medicareEmployer = medicareEmployer.add(row.getEmployerTaxes().getMedicare());
        futa = futa.add(row.getEmployerTaxes().getFuta());
        suta = suta.add(row.getEmployerTaxes().getSuta());
        otherDeductions = otherDeductions.add(row.getOtherDeductions());
        netPay = netPay.add(row.getNetPay());
        socialSecurityTaxableWages = socialSecurityTaxableWages.add(row.getTaxableWages().getSocialSecurity());
        medicareWages = medicareWages.add(row.getTaxableWages().getMedicare());
        futaTaxableWages = futaTaxableWages.add(row.getTaxableWages().getFuta());
        sutaTaxableWages = sutaTaxableWages.add(row.getTaxableWages().getSuta());
    }

    public String getCompanyId() { return companyId; }
    public String getEmployeeId() { return employeeId; }
    public int getYear() { return year; }
    public int getThroughMonth() { return throughMonth; }
    public int getPayPeriods() { return payPeriods; }
    public BigDecimal getGrossPay() { return grossPay; }
    public BigDecimal getFederalIncomeTax() { return federalIncomeTax; }
    public BigDecimal getSocialSecurityEmployee() { return socialSecurityEmployee; }
    public BigDecimal getMedicareEmployee() { return medicareEmployee; }
    public BigDecimal getAdditionalMedicareEmployee() { return additionalMedicareEmployee; }
    public BigDecimal getSocialSecurityEmployer() { return socialSecurityEmployer; }
    public BigDecimal getMedicareEmployer() { return medicareEmployer; }
    public BigDecimal getFuta() { return futa; }
    public BigDecimal getSuta() { return suta; }
    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public BigDecimal getNetPay() { return netPay; }
    public BigDecimal getSocialSecurityTaxableWages() { return socialSecurityTaxableWages; }
    public BigDecimal getMedicareWages() { return medicareWages; }
    public BigDecimal getFutaTaxableWages() { return futaTaxableWages; }
    public BigDecimal getSutaTaxableWages() { return sutaTaxableWages; }
}
