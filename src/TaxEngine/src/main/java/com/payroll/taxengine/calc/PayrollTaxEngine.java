package com.payroll.taxengine.calc;

import com.payroll.taxengine.config.ConfigResolution;
import com.payroll.taxengine.config.TaxYearConfig;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayrollRunInput;
import com.payroll.taxengine.model.YearToDateWages;

import java.util.Collection;

/**
 * Resolves the tax year for a run, refuses to calculate past a failed validation, and
 * computes the ledger row.
 */
public class PayrollTaxEngine {

    private final TaxYearConfigRepository repository;
    private final WithholdingCalculator calculator;

    public PayrollTaxEngine(TaxYearConfigRepository repository) {
        this(repository, new WithholdingCalculator());
    }

    public PayrollTaxEngine(TaxYearConfigRepository repository, WithholdingCalculator calculator) {
        this.repository = repository;
        this.calculator = calculator;
    }

    public PayrollLedgerRow compute(CompanyTaxProfile company, EmployeePayProfile profile, PayrollRunInput run,
                                    YearToDateWages priorYtd) {
        TaxYearConfig config = resolveFor(profile, run).requirePassed();
        return calculator.compute(profile, run, priorYtd, company, config);
    }

    /** Same as {@link #compute} with prior year-to-date wages summed from already persisted rows. */
    public PayrollLedgerRow computeFromLedger(CompanyTaxProfile company, EmployeePayProfile profile,
                                              PayrollRunInput run, Collection<PayrollLedgerRow> history) {
        if (company == null) throw new InvalidInputException("company", "Company profile is required");
        TaxYearConfig config = resolveFor(profile, run).requirePassed();
        YearToDateWages prior = YearToDateWages.fromLedger(history, company.getCompanyId(),
            profile.getEmployeeId(), run.getPayDate());
        return calculator.compute(profile, run, prior, company, config);
    }

    public TaxYearConfigRepository getRepository() {
        return repository;
    }

    private ConfigResolution resolveFor(EmployeePayProfile profile, PayrollRunInput run) {
        if (profile == null || profile.getPayFrequency() == null || profile.getPayFrequency().isBlank()) {
            throw new InvalidInputException("pay_frequency", "Employee pay frequency is required");
        }
        if (run == null || run.getPayDate() == null) {
            throw new InvalidInputException("pay_date", "Pay date is required");
        }
        return repository.resolve(run.effectiveYear(), profile.getPayFrequency());
    }
}
