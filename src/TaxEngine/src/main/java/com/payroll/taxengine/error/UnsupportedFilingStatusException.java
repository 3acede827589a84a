package com.payroll.taxengine.error;

import java.util.Collection;

public class UnsupportedFilingStatusException extends PayrollTaxException {

    public UnsupportedFilingStatusException(String filingStatus, int year, Collection<String> supported) {
        super(ErrorKind.UNSUPPORTED_FILING_STATUS, "filing_status",
            "Filing status '" + filingStatus + "' is not defined for tax year " + year
                + "; supported: " + supported);
    }
}
