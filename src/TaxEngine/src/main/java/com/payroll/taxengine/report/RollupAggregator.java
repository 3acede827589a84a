package com.payroll.taxengine.report;

import com.payroll.taxengine.calc.Money;
import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.RateParser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds ledger rows into the quarterly 941 and RT-6 totals, the annual 940 totals and
 * per-employee year-to-date summaries.
 *
 * <p>The caller supplies a closed snapshot of rows. Only rows of the requested company and
 * period are counted. Every fold is a sum of cent amounts, so permuting the rows or
 * aggregating twice yields equal summaries.
 */
public class RollupAggregator {

    public QuarterlyReports aggregateQuarter(Collection<PayrollLedgerRow> rows, CompanyTaxProfile company,
                                             int year, int quarter) {
        return new QuarterlyReports(form941(rows, company, year, quarter), rt6(rows, company, year, quarter));
    }

    public Form941Summary form941(Collection<PayrollLedgerRow> rows, CompanyTaxProfile company, int year, int quarter) {
        List<PayrollLedgerRow> selected = quarterRows(rows, company, year, quarter);
        BigDecimal wages = BigDecimal.ZERO;
        BigDecimal fit = BigDecimal.ZERO;
        BigDecimal ssWages = BigDecimal.ZERO;
        BigDecimal ssTax = BigDecimal.ZERO;
        BigDecimal medicareWages = BigDecimal.ZERO;
        BigDecimal medicareTax = BigDecimal.ZERO;
        BigDecimal additionalWages = BigDecimal.ZERO;
        BigDecimal additionalTax = BigDecimal.ZERO;
        Set<String> employees = new HashSet<>();
        for (PayrollLedgerRow row : selected) {
            employees.add(row.getEmployeeId());
            wages = wages.add(row.grossPay());
            fit = fit.add(row.getEmployeeTaxes().getFederalIncomeTax());
            ssWages = ssWages.add(row.getTaxableWages().getSocialSecurity());
            ssTax = ssTax.add(row.getEmployeeTaxes().getSocialSecurity()).add(row.getEmployerTaxes().getSocialSecurity());
            medicareWages = medicareWages.add(row.getTaxableWages().getMedicare());
            medicareTax = medicareTax.add(row.getEmployeeTaxes().getMedicare()).add(row.getEmployerTaxes().getMedicare());
            additionalWages = additionalWages.add(row.getTaxableWages().getAdditionalMedicare());
            additionalTax = additionalTax.add(row.getEmployeeTaxes().getAdditionalMedicare());
        }
        return new Form941Summary(company.getCompanyId(), year, quarter, employees.size(), cents(wages), cents(fit),
            cents(ssWages), cents(ssTax), cents(medicareWages), cents(medicareTax), cents(additionalWages),
            cents(additionalTax));
    }

    public Rt6Summary rt6(Collection<PayrollLedgerRow> rows, CompanyTaxProfile company, int year, int quarter) {
        if (company.getSutaRate() == null) {
            throw new InvalidInputException("suta_rate", "Company " + company.getCompanyId() + " has no SUTA rate");
        }
        BigDecimal rate = RateParser.parseEmployerRate("suta_rate", company.getSutaRate());
        List<PayrollLedgerRow> selected = quarterRows(rows, company, year, quarter);
        List<EmployeeWageDetail> detail = detail(selected, row -> row.getTaxableWages().getSuta());
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal taxable = BigDecimal.ZERO;
        for (EmployeeWageDetail line : detail) {
            gross = gross.add(line.getGrossWages());
            taxable = taxable.add(line.getTaxableWages());
        }
        BigDecimal contributions = selected.stream()
            .map(row -> row.getEmployerTaxes().getSuta())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new Rt6Summary(company.getCompanyId(), year, quarter, rate,
            cents(gross), cents(taxable), Money.cents(taxable.multiply(rate)), cents(contributions), detail);
    }

    public Form940Summary aggregateYear(Collection<PayrollLedgerRow> rows, CompanyTaxProfile company, int year) {
        List<PayrollLedgerRow> selected = rows.stream()
            .filter(row -> row.getCompanyId().equals(company.getCompanyId()) && row.getYear() == year)
            .collect(Collectors.toList());
        BigDecimal futaRate = RateConsistency.single("statutory_rates.futa.employer_rate", selected,
            row -> row.getStatutoryRates().getFutaRate());
        BigDecimal wageBase = RateConsistency.single("statutory_rates.futa.wage_base", selected,
            row -> row.getStatutoryRates().getFutaWageBase());

        List<EmployeeWageDetail> detail = detail(selected, row -> row.getTaxableWages().getFuta());
        BigDecimal payments = BigDecimal.ZERO;
        BigDecimal taxable = BigDecimal.ZERO;
        List<String> warnings = new ArrayList<>();
        for (EmployeeWageDetail line : detail) {
            payments = payments.add(line.getGrossWages());
            taxable = taxable.add(line.getTaxableWages());
            if (wageBase != null && line.getTaxableWages().compareTo(wageBase) > 0) {
                warnings.add("Employee " + line.getEmployeeId() + " FUTA taxable wages "
                    + line.getTaxableWages().toPlainString() + " exceed the wage base " + wageBase.toPlainString());
            }
        }
        BigDecimal ledgerTax = selected.stream()
            .map(row -> row.getEmployerTaxes().getFuta())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal futaTax = futaRate == null ? Money.ZERO : Money.cents(taxable.multiply(futaRate));
        return new Form940Summary(company.getCompanyId(), year, futaRate, wageBase, cents(payments), cents(taxable),
            futaTax, cents(ledgerTax), detail, warnings);
    }

    /** Totals for one employee from January through {@code throughMonth} inclusive. */
    public YearToDateSummary yearToDate(Collection<PayrollLedgerRow> rows, String companyId, String employeeId,
                                        int year, int throughMonth) {
        if (throughMonth < 1 || throughMonth > 12) {
            throw new InvalidInputException("through_month", "Month must be between 1 and 12, got " + throughMonth);
        }
        YearToDateSummary summary = new YearToDateSummary(companyId, employeeId, year, throughMonth);
        for (PayrollLedgerRow row : rows) {
            if (row.getCompanyId().equals(companyId) && row.getEmployeeId().equals(employeeId)
                && row.getYear() == year && row.getMonth() <= throughMonth) {
                summary.add(row);
            }
        }
        return summary;
    }

    private static List<PayrollLedgerRow> quarterRows(Collection<PayrollLedgerRow> rows, CompanyTaxProfile company,
                                                      int year, int quarter) {
        if (quarter < 1 || quarter > 4) {
            throw new InvalidInputException("quarter", "Quarter must be between 1 and 4, got " + quarter);
        }
        return rows.stream()
            .filter(row -> row.getCompanyId().equals(company.getCompanyId()))
            .filter(row -> row.getYear() == year && row.quarter() == quarter)
            .collect(Collectors.toList());
    }

    /** Gross and taxable wages per employee, ordered by employee id. */
    private static List<EmployeeWageDetail> detail(List<PayrollLedgerRow> rows,
                                                   Function<PayrollLedgerRow, BigDecimal> taxable) {
        Map<String, BigDecimal[]> byEmployee = new TreeMap<>();
        for (PayrollLedgerRow row : rows) {
            BigDecimal[] sums = byEmployee.computeIfAbsent(row.getEmployeeId(),
                id -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            sums[0] = sums[0].add(row.grossPay());
            sums[1] = sums[1].add(taxable.apply(row));
        }
        List<EmployeeWageDetail> detail = new ArrayList<>();
        byEmployee.forEach((id, sums) -> detail.add(new EmployeeWageDetail(id, cents(sums[0]), cents(sums[1]))));
        return detail;
    }

    private static BigDecimal cents(BigDecimal value) {
        return Money.cents(value);
    }
}
