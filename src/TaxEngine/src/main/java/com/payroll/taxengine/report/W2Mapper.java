package com.payroll.taxengine.report;

import com.payroll.taxengine.calc.Money;
import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Derives W-2 boxes from one employee's ledger rows for one year.
 *
 * <p>Boxes 3 and 5 divide the tax withheld by the employee rate. That is only exact when
 * every row used the same rate, so a row set spanning a rate change is rejected with
 * {@link com.payroll.taxengine.error.InconsistentRateAcrossPeriodException} rather than
 * averaged.
 */
public class W2Mapper {

    public W2Boxes mapYear(Collection<PayrollLedgerRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidInputException("rows", "No ledger rows to map");
        }
        PayrollLedgerRow first = rows.iterator().next();
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal fit = BigDecimal.ZERO;
        BigDecimal ssTax = BigDecimal.ZERO;
        BigDecimal medicareTax = BigDecimal.ZERO;
        BigDecimal additionalMedicare = BigDecimal.ZERO;
        BigDecimal ssWages = BigDecimal.ZERO;
        BigDecimal medicareWages = BigDecimal.ZERO;
        for (PayrollLedgerRow row : rows) {
            if (!row.getCompanyId().equals(first.getCompanyId()) || !row.getEmployeeId().equals(first.getEmployeeId())
                || row.getYear() != first.getYear()) {
                throw new InvalidInputException("rows", "W-2 rows must belong to one company, employee and year; found "
                    + row.key() + " alongside " + first.key());
            }
            gross = gross.add(row.grossPay());
            fit = fit.add(row.getEmployeeTaxes().getFederalIncomeTax());
            ssTax = ssTax.add(row.getEmployeeTaxes().getSocialSecurity());
            medicareTax = medicareTax.add(row.getEmployeeTaxes().getMedicare());
            additionalMedicare = additionalMedicare.add(row.getEmployeeTaxes().getAdditionalMedicare());
            ssWages = ssWages.add(row.getTaxableWages().getSocialSecurity());
            medicareWages = medicareWages.add(row.getTaxableWages().getMedicare());
        }

        BigDecimal ssRate = RateConsistency.single("statutory_rates.social_security.employee_rate", rows,
            row -> row.getStatutoryRates().getSocialSecurityEmployeeRate());
        BigDecimal medicareRate = RateConsistency.single("statutory_rates.medicare.employee_rate", rows,
            row -> row.getStatutoryRates().getMedicareEmployeeRate());

        return new W2Boxes(first.getCompanyId(), first.getEmployeeId(), first.getYear(),
            Money.cents(gross),
            Money.cents(fit),
            backDerive("social_security_employee_rate", ssTax, ssRate),
            Money.cents(ssTax),
            backDerive("medicare_employee_rate", medicareTax, medicareRate),
            Money.cents(medicareTax.add(additionalMedicare)),
            ssRate,
            medicareRate,
            Money.cents(ssWages),
            Money.cents(medicareWages));
    }

    private static BigDecimal backDerive(String field, BigDecimal tax, BigDecimal rate) {
        if (rate.signum() == 0) {
            if (tax.signum() == 0) return Money.ZERO;
            throw new InvalidInputException(field, "Cannot back-derive wages from a zero rate");
        }
        return Money.divideToCents(tax, rate);
    }
}
