package com.payroll.taxengine.calc;

import com.payroll.taxengine.config.FitBracket;
import com.payroll.taxengine.config.FitTable;
import com.payroll.taxengine.config.StatutoryRates;
import com.payroll.taxengine.config.TaxYearConfig;
import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.error.NegativeInputRejectedException;
import com.payroll.taxengine.ledger.Earnings;
import com.payroll.taxengine.ledger.EmployeeTaxes;
import com.payroll.taxengine.ledger.EmployerTaxes;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.ledger.TaxableWages;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayType;
import com.payroll.taxengine.model.PayrollRunInput;
import com.payroll.taxengine.model.RateParser;
import com.payroll.taxengine.model.YearToDateWages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;

import static com.payroll.taxengine.calc.TraceRecorder.inputs;

/**
 * Computes one payroll run: gross pay, federal income tax by the annualized percentage
 * method, Social Security, Medicare and Additional Medicare, FUTA and Florida SUTA, and net
 * pay. Pure: the result depends only on the arguments, and the same arguments always give
 * an equal row with an identical trace.
 *
 * <p>Wage-base caps and the Additional Medicare threshold are applied against the
 * caller-supplied prior year-to-date figures; nothing is read from or written to shared state.
 */
public class WithholdingCalculator {

    private static final Logger log = LoggerFactory.getLogger(WithholdingCalculator.class);

    public PayrollLedgerRow compute(EmployeePayProfile profile, PayrollRunInput run, YearToDateWages priorYtd,
                                    CompanyTaxProfile company, TaxYearConfig config) {
        if (profile == null) throw new InvalidInputException("employee", "Employee profile is required");
        if (run == null) throw new InvalidInputException("run", "Payroll run input is required");
        if (company == null) throw new InvalidInputException("company", "Company profile is required");
        if (config == null) throw new InvalidInputException("config", "Resolved tax configuration is required");
        YearToDateWages prior = priorYtd == null ? YearToDateWages.none() : priorYtd;

        LocalDate payDate = checkPeriod(run, config);
        checkProfile(profile, config);
        if (company.getCompanyId() == null || company.getCompanyId().isBlank()) {
            throw new InvalidInputException("company_id", "Company id is required");
        }
        BigDecimal sutaRate = requireRate(company.getSutaRate());
        FitTable fitTable = config.fitTable(profile.getFilingStatus());
        StatutoryRates rates = config.getRates();

        BigDecimal bonus = nonNegative("bonus", Money.orZero(run.getBonus()));
        BigDecimal reimbursements = nonNegative("reimbursements", Money.orZero(run.getReimbursements()));
        BigDecimal otherDeductions = nonNegative("other_deductions", Money.orZero(run.getOtherDeductions()));
        BigDecimal priorSs = nonNegative("prior_ytd.social_security_taxable_wages",
            Money.orZero(prior.getSocialSecurityTaxableWages()));
        BigDecimal priorMedicare = nonNegative("prior_ytd.medicare_wages", Money.orZero(prior.getMedicareWages()));
        BigDecimal priorFuta = nonNegative("prior_ytd.futa_taxable_wages", Money.orZero(prior.getFutaTaxableWages()));
        BigDecimal priorSuta = nonNegative("prior_ytd.suta_taxable_wages", Money.orZero(prior.getSutaTaxableWages()));

        TraceRecorder trace = new TraceRecorder();

        // 1. gross
        BigDecimal hours = hoursFor(profile, run);
        BigDecimal regularPay = profile.getPayType() == PayType.SALARY
            ? trace.cents("gross.regular_pay", "base_rate",
                inputs("base_rate", profile.getBaseRate()), profile.getBaseRate())
            : trace.cents("gross.regular_pay", "base_rate * hours_worked",
                inputs("base_rate", profile.getBaseRate(), "hours_worked", hours),
                profile.getBaseRate().multiply(hours));
        BigDecimal grossPay = trace.cents("gross.total", "regular_pay + bonus + reimbursements",
            inputs("regular_pay", regularPay, "bonus", bonus, "reimbursements", reimbursements),
            regularPay.add(bonus).add(reimbursements));

        // 2. federal income tax
        BigDecimal fit = federalIncomeTax(profile, grossPay, fitTable, config.getPeriodsPerYear(), trace);

        // 3. social security
        BigDecimal ssHeadroom = trace.exact("social_security.headroom", "max(0, wage_base - prior_ytd_taxable_wages)",
            inputs("wage_base", rates.getSocialSecurityWageBase(), "prior_ytd_taxable_wages", priorSs),
            Money.atLeastZero(rates.getSocialSecurityWageBase().subtract(priorSs)));
        BigDecimal ssTaxable = trace.cents("social_security.taxable_wages", "min(gross_pay, headroom)",
            inputs("gross_pay", grossPay, "headroom", ssHeadroom), grossPay.min(ssHeadroom));
        BigDecimal ssEmployee = trace.cents("social_security.employee", "taxable_wages * employee_rate",
            inputs("taxable_wages", ssTaxable, "employee_rate", rates.getSocialSecurityEmployeeRate()),
            ssTaxable.multiply(rates.getSocialSecurityEmployeeRate()));
        BigDecimal ssEmployer = trace.cents("social_security.employer", "taxable_wages * employer_rate",
            inputs("taxable_wages", ssTaxable, "employer_rate", rates.getSocialSecurityEmployerRate()),
            ssTaxable.multiply(rates.getSocialSecurityEmployerRate()));

        // 4. medicare, uncapped, plus the additional employee tax above the threshold
        BigDecimal medicareEmployee = trace.cents("medicare.employee", "gross_pay * employee_rate",
            inputs("gross_pay", grossPay, "employee_rate", rates.getMedicareEmployeeRate()),
            grossPay.multiply(rates.getMedicareEmployeeRate()));
        BigDecimal medicareEmployer = trace.cents("medicare.employer", "gross_pay * employer_rate",
            inputs("gross_pay", grossPay, "employer_rate", rates.getMedicareEmployerRate()),
            grossPay.multiply(rates.getMedicareEmployerRate()));
        BigDecimal threshold = rates.getAdditionalMedicareThreshold();
        BigDecimal additionalTaxable = trace.cents("additional_medicare.taxable_wages",
            "max(0, prior_ytd_medicare_wages + gross_pay - threshold) - max(0, prior_ytd_medicare_wages - threshold)",
            inputs("prior_ytd_medicare_wages", priorMedicare, "gross_pay", grossPay, "threshold", threshold),
            Money.atLeastZero(priorMedicare.add(grossPay).subtract(threshold))
                .subtract(Money.atLeastZero(priorMedicare.subtract(threshold))));
        BigDecimal additionalMedicare = trace.cents("additional_medicare.employee", "taxable_wages * additional_rate",
            inputs("taxable_wages", additionalTaxable, "additional_rate", rates.getAdditionalMedicareRate()),
            additionalTaxable.multiply(rates.getAdditionalMedicareRate()));

        // 5. FUTA
        BigDecimal futaTaxable = cappedTaxable("futa", grossPay, rates.getFutaWageBase(), priorFuta, trace);
        BigDecimal futa = trace.cents("futa.employer", "taxable_wages * futa_rate",
            inputs("taxable_wages", futaTaxable, "futa_rate", rates.getFutaRate()),
            futaTaxable.multiply(rates.getFutaRate()));

        // 6. SUTA at the company's assigned rate
        BigDecimal sutaTaxable = cappedTaxable("suta", grossPay, rates.getSutaWageBase(), priorSuta, trace);
        BigDecimal suta = trace.cents("suta.employer", "taxable_wages * suta_rate",
            inputs("taxable_wages", sutaTaxable, "suta_rate", sutaRate),
            sutaTaxable.multiply(sutaRate));

        // 7. net
        BigDecimal deductions = Money.cents(otherDeductions);
        BigDecimal netPay = trace.cents("net_pay",
            "gross_pay - (fit + social_security_employee + medicare_employee + additional_medicare + other_deductions)",
            inputs("gross_pay", grossPay, "fit", fit, "social_security_employee", ssEmployee,
                "medicare_employee", medicareEmployee, "additional_medicare", additionalMedicare,
                "other_deductions", deductions),
            grossPay.subtract(fit.add(ssEmployee).add(medicareEmployee).add(additionalMedicare).add(deductions)));

        log.debug("Computed run: company={}, employee={}, payDate={}, gross={}, net={}",
            company.getCompanyId(), profile.getEmployeeId(), payDate, grossPay, netPay);

        return new PayrollLedgerRow(
            company.getCompanyId(),
            profile.getEmployeeId(),
            payDate,
            config.getYear(),
            run.effectiveMonth(),
            config.getPayFrequency(),
            fitTable.getFilingStatus(),
            profile.getPayType(),
            hours,
            new Earnings(regularPay, Money.cents(bonus), Money.cents(reimbursements), grossPay),
            new TaxableWages(ssTaxable, grossPay, additionalTaxable, futaTaxable, sutaTaxable),
            new EmployeeTaxes(fit, ssEmployee, medicareEmployee, additionalMedicare),
            new EmployerTaxes(ssEmployer, medicareEmployer, futa, suta),
            deductions,
            netPay,
            rates,
            sutaRate,
            config.stamp(),
            trace.build());
    }

    private BigDecimal federalIncomeTax(EmployeePayProfile profile, BigDecimal grossPay, FitTable table,
                                        int periodsPerYear, TraceRecorder trace) {
        BigDecimal periods = BigDecimal.valueOf(periodsPerYear);
        if (grossPay.signum() <= 0) {
            return trace.exact("fit.withholding", "gross_pay <= 0", inputs("gross_pay", grossPay), Money.ZERO);
        }
        BigDecimal otherIncome = nonNegative("w4_other_income", Money.orZero(profile.getW4OtherIncome()));
        BigDecimal w4Deductions = nonNegative("w4_deductions", Money.orZero(profile.getW4Deductions()));
        BigDecimal credit = nonNegative("w4_dependents_credit", Money.orZero(profile.getW4DependentsCredit()));
        BigDecimal extra = nonNegative("w4_extra_withholding", Money.orZero(profile.getW4ExtraWithholding()));

        BigDecimal annualWages = trace.exact("fit.annual_wages", "gross_pay * periods_per_year",
            inputs("gross_pay", grossPay, "periods_per_year", periodsPerYear), grossPay.multiply(periods));
        BigDecimal adjusted = trace.exact("fit.adjusted_annual_wages",
            "max(0, annual_wages + other_income - deductions - standard_deduction)",
            inputs("annual_wages", annualWages, "other_income", otherIncome, "deductions", w4Deductions,
                "standard_deduction", table.getStandardDeduction()),
            Money.atLeastZero(annualWages.add(otherIncome).subtract(w4Deductions)
                .subtract(table.getStandardDeduction())));

        int index = table.bracketIndexFor(adjusted);
        BigDecimal annualTax;
        if (index < 0) {
            annualTax = trace.exact("fit.annual_tax", "below first bracket",
                inputs("adjusted_annual_wages", adjusted), BigDecimal.ZERO);
        } else {
            FitBracket bracket = table.getBrackets().get(index);
            annualTax = trace.exact("fit.annual_tax", "base_tax + rate * (adjusted_annual_wages - over)",
                inputs("filing_status", table.getFilingStatus(), "bracket", index, "over", bracket.getOver(),
                    "rate", bracket.getRate(), "base_tax", bracket.getBaseTax(), "adjusted_annual_wages", adjusted),
                bracket.getBaseTax().add(bracket.getRate().multiply(adjusted.subtract(bracket.getOver()))));
        }
        BigDecimal afterCredit = trace.exact("fit.annual_tax_after_credit", "max(0, annual_tax - dependents_credit)",
            inputs("annual_tax", annualTax, "dependents_credit", credit),
            Money.atLeastZero(annualTax.subtract(credit)));
        BigDecimal perPeriod = trace.divide("fit.per_period", "annual_tax_after_credit / periods_per_year",
            inputs("annual_tax_after_credit", afterCredit, "periods_per_year", periodsPerYear),
            afterCredit, periods);
        return trace.cents("fit.withholding", "per_period + extra_withholding",
            inputs("per_period", perPeriod, "extra_withholding", extra), perPeriod.add(extra));
    }

    private BigDecimal cappedTaxable(String prefix, BigDecimal grossPay, BigDecimal wageBase, BigDecimal prior,
                                     TraceRecorder trace) {
        BigDecimal headroom = trace.exact(prefix + ".headroom", "max(0, wage_base - prior_ytd_taxable_wages)",
            inputs("wage_base", wageBase, "prior_ytd_taxable_wages", prior),
            Money.atLeastZero(wageBase.subtract(prior)));
        return trace.cents(prefix + ".taxable_wages", "min(gross_pay, headroom)",
            inputs("gross_pay", grossPay, "headroom", headroom), grossPay.min(headroom));
    }

    private LocalDate checkPeriod(PayrollRunInput run, TaxYearConfig config) {
        LocalDate payDate = run.getPayDate();
        if (payDate == null) {
            throw new InvalidInputException("pay_date", "Pay date is required");
        }
        if (run.getYear() != null && run.getYear() != payDate.getYear()) {
            throw new InvalidInputException("year",
                "Run year " + run.getYear() + " does not match pay date " + payDate);
        }
        int month = run.effectiveMonth();
        if (month < 1 || month > 12) {
            throw new InvalidInputException("month", "Month must be between 1 and 12, got " + month);
        }
        if (month != payDate.getMonthValue()) {
            throw new InvalidInputException("month",
                "Run month " + month + " does not match pay date " + payDate);
        }
        if (payDate.getYear() != config.getYear()) {
            throw new InvalidInputException("year", "Pay date " + payDate
                + " falls outside tax year " + config.getYear() + " of the resolved configuration");
        }
        return payDate;
    }

    private void checkProfile(EmployeePayProfile profile, TaxYearConfig config) {
        if (profile.getEmployeeId() == null || profile.getEmployeeId().isBlank()) {
            throw new InvalidInputException("employee_id", "Employee id is required");
        }
        if (profile.getPayType() == null) {
            throw new InvalidInputException("pay_type", "Pay type is required (salary or hourly)");
        }
        if (profile.getBaseRate() == null) {
            throw new InvalidInputException("base_rate", "Base rate is required");
        }
        nonNegative("base_rate", profile.getBaseRate());
        if (profile.getPayFrequency() != null && !profile.getPayFrequency().equals(config.getPayFrequency())) {
            throw new InvalidInputException("pay_frequency", "Employee pay frequency '" + profile.getPayFrequency()
                + "' does not match the resolved configuration '" + config.getPayFrequency() + "'");
        }
    }

    private BigDecimal hoursFor(EmployeePayProfile profile, PayrollRunInput run) {
        if (profile.getPayType() == PayType.SALARY) {
            return run.getHoursWorked() == null ? null : nonNegative("hours_worked", run.getHoursWorked());
        }
        if (run.getHoursWorked() != null) {
            return nonNegative("hours_worked", run.getHoursWorked());
        }
        if (profile.getStandardHours() != null) {
            return nonNegative("standard_hours", profile.getStandardHours());
        }
        throw new InvalidInputException("hours_worked", "Hourly employee needs hours worked or standard hours");
    }

    private BigDecimal requireRate(BigDecimal sutaRate) {
        if (sutaRate == null) {
            throw new InvalidInputException("suta_rate", "Company SUTA rate is required");
        }
        return RateParser.parseEmployerRate("suta_rate", sutaRate);
    }

    private static BigDecimal nonNegative(String field, BigDecimal value) {
        if (value.signum() < 0) {
            throw new NegativeInputRejectedException(field, value);
        }
        return value;
    }
}
