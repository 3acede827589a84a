package com.payroll.taxengine.error;

import java.util.Collection;

public class UnsupportedFrequencyException extends PayrollTaxException {

    public UnsupportedFrequencyException(String payFrequency, int year, Collection<String> supported) {
        super(ErrorKind.UNSUPPORTED_FREQUENCY, "pay_frequency",
            "Pay frequency '" + payFrequency + "' is not defined for tax year " + year
                + "; supported: " + supported);
    }
}
