package com.payroll.taxengine.error;

import java.util.List;

/**
 * Tax-year data exists but is malformed or fails the validation gate.
 */
public class ConfigInvalidException extends PayrollTaxException {

    public ConfigInvalidException(int year, String payFrequency, List<ValidationFailure> failures) {
        super(ErrorKind.CONFIG_INVALID,
            "Invalid tax configuration for year " + year
                + (payFrequency == null ? "" : ", frequency '" + payFrequency + "'")
                + " (" + failures.size() + " problem" + (failures.size() == 1 ? "" : "s") + ")",
            failures);
    }
}
