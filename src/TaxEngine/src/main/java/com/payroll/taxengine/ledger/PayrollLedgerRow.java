package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payroll.taxengine.config.ConfigStamp;
import com.payroll.taxengine.config.StatutoryRates;
import com.payroll.taxengine.model.PayType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The engine's output for one (company, employee, pay date): inputs echoed, every computed
 * amount, the parameters in effect and the full calculation trace.
 *
 * <p>Rows are never mutated. A correction is a recomputation that produces a new row for
 * the same {@link #key()}; the superseded row stays available for audit.
 */
@JsonPropertyOrder({"company_id", "employee_id", "pay_date", "year", "month", "pay_frequency",
    "filing_status", "pay_type", "hours_worked", "earnings", "taxable_wages", "employee_taxes",
    "employer_taxes", "other_deductions", "net_pay", "statutory_rates", "suta_rate", "config", "calculation_trace"})
public final class PayrollLedgerRow {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("employee_id")
    private final String employeeId;

    @JsonProperty("pay_date")
    private final LocalDate payDate;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("month")
    private final int month;

    @JsonProperty("pay_frequency")
    private final String payFrequency;

    @JsonProperty("filing_status")
    private final String filingStatus;

    @JsonProperty("pay_type")
    private final PayType payType;

    @JsonProperty("hours_worked")
    private final BigDecimal hoursWorked;

    @JsonProperty("earnings")
    private final Earnings earnings;

    @JsonProperty("taxable_wages")
    private final TaxableWages taxableWages;

    @JsonProperty("employee_taxes")
    private final EmployeeTaxes employeeTaxes;

    @JsonProperty("employer_taxes")
    private final EmployerTaxes employerTaxes;

    @JsonProperty("other_deductions")
    private final BigDecimal otherDeductions;

    @JsonProperty("net_pay")
    private final BigDecimal netPay;

    @JsonProperty("statutory_rates")
    private final StatutoryRates statutoryRates;

    @JsonProperty("suta_rate")
    private final BigDecimal sutaRate;

    @JsonProperty("config")
    private final ConfigStamp config;

    @JsonProperty("calculation_trace")
    private final CalculationTrace calculationTrace;

    @JsonCreator
    public PayrollLedgerRow(@JsonProperty("company_id") String companyId,
                            @JsonProperty("employee_id") String employeeId,
                            @JsonProperty("pay_date") LocalDate payDate,
                            @JsonProperty("year") int year,
                            @JsonProperty("month") int month,
                            @JsonProperty("pay_frequency") String payFrequency,
                            @JsonProperty("filing_status") String filingStatus,
                            @JsonProperty("pay_type") PayType payType,
                            @JsonProperty("hours_worked") BigDecimal hoursWorked,
                            @JsonProperty("earnings") Earnings earnings,
                            @JsonProperty("taxable_wages") TaxableWages taxableWages,
                            @JsonProperty("employee_taxes") EmployeeTaxes employeeTaxes,
                            @JsonProperty("employer_taxes") EmployerTaxes employerTaxes,
                            @JsonProperty("other_deductions") BigDecimal otherDeductions,
                            @JsonProperty("net_pay") BigDecimal netPay,
                            @JsonProperty("statutory_rates") StatutoryRates statutoryRates,
                            @JsonProperty("suta_rate") BigDecimal sutaRate,
                            @JsonProperty("config") ConfigStamp config,
                            @JsonProperty("calculation_trace") CalculationTrace calculationTrace) {
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.employeeId = Objects.requireNonNull(employeeId, "employeeId");
        this.payDate = Objects.requireNonNull(payDate, "payDate");
        this.year = year;
        this.month = month;
        this.payFrequency = payFrequency;
        this.filingStatus = filingStatus;
        this.payType = payType;
        this.hoursWorked = hoursWorked;
        this.earnings = Objects.requireNonNull(earnings, "earnings");
        this.taxableWages = Objects.requireNonNull(taxableWages, "taxableWages");
        this.employeeTaxes = Objects.requireNonNull(employeeTaxes, "employeeTaxes");
        this.employerTaxes = Objects.requireNonNull(employerTaxes, "employerTaxes");
        this.otherDeductions = Objects.requireNonNull(otherDeductions, "otherDeductions");
        this.netPay = Objects.requireNonNull(netPay, "netPay");
        this.statutoryRates = Objects.requireNonNull(statutoryRates, "statutoryRates");
        this.sutaRate = Objects.requireNonNull(sutaRate, "sutaRate");
        this.config = config;
        this.calculationTrace = calculationTrace;
    }

    public String getCompanyId() { return companyId; }
    public String getEmployeeId() { return employeeId; }
    public LocalDate getPayDate() { return payDate; }
    public int getYear() { return year; }
    public int getMonth() { return month; }
    public String getPayFrequency() { return payFrequency; }
    public String getFilingStatus() { return filingStatus; }
    public PayType getPayType() { return payType; }
    public BigDecimal getHoursWorked() { return hoursWorked; }
    public Earnings getEarnings() { return earnings; }
    public TaxableWages getTaxableWages() { return taxableWages; }
    public EmployeeTaxes getEmployeeTaxes() { return employeeTaxes; }
    public EmployerTaxes getEmployerTaxes() { return employerTaxes; }
    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public BigDecimal getNetPay() { return netPay; }
    public StatutoryRates getStatutoryRates() { return statutoryRates; }
    public BigDecimal getSutaRate() { return sutaRate; }
    public ConfigStamp getConfig() { return config; }
    public CalculationTrace getCalculationTrace() { return calculationTrace; }

    public BigDecimal grossPay() {
        return earnings.getGrossPay();
    }

    /** Calendar quarter (1-4) of the row's month. */
    public int quarter() {
        return (month - 1) / 3 + 1;
    }

    /** Identity of the (company, employee, pay date) this row belongs to. */
    public String key() {
        return key(companyId, employeeId, payDate);
    }

    public static String key(String companyId, String employeeId, LocalDate payDate) {
        return companyId + "|" + employeeId + "|" + payDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PayrollLedgerRow)) return false;
        PayrollLedgerRow that = (PayrollLedgerRow) o;
        return year == that.year
            && month == that.month
            && companyId.equals(that.companyId)
            && employeeId.equals(that.employeeId)
            && payDate.equals(that.payDate)
            && Objects.equals(payFrequency, that.payFrequency)
            && Objects.equals(filingStatus, that.filingStatus)
            && payType == that.payType
            && Objects.equals(hoursWorked, that.hoursWorked)
            && earnings.equals(that.earnings)
            && taxableWages.equals(that.taxableWages)
            && employeeTaxes.equals(that.employeeTaxes)
            && employerTaxes.equals(that.employerTaxes)
            && otherDeductions.equals(that.otherDeductions)
            && netPay.equals(that.netPay)
            && statutoryRates.equals(that.statutoryRates)
            && sutaRate.equals(that.sutaRate)
            && Objects.equals(config, that.config)
            && Objects.equals(calculationTrace, that.calculationTrace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(companyId, employeeId, payDate, year, month, earnings, netPay);
    }

    @Override
    public String toString() {
        return "PayrollLedgerRow{" + key() + ", gross=" + grossPay().toPlainString()
            + ", net=" + netPay.toPlainString() + "}";
    }
}
