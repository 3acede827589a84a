package com.payroll.taxengine.config;

import java.util.List;

/**
 * Parsed, not yet validated, tax-year data for one frequency.
 */
public final class LoadedTaxYear {

    private final TaxYearConfig config;
    private final ValidationExpectations expectations;
    private final List<String> checkedFiles;

    LoadedTaxYear(TaxYearConfig config, ValidationExpectations expectations, List<String> checkedFiles) {
        this.config = config;
        this.expectations = expectations;
        this.checkedFiles = List.copyOf(checkedFiles);
    }

    public TaxYearConfig getConfig() { return config; }

    /** Null when the year ships no {@code validation.json}. */
    public ValidationExpectations getExpectations() { return expectations; }

    public List<String> getCheckedFiles() { return checkedFiles; }
}
