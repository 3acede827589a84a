package com.payroll.taxengine.error;

/**
 * Input that is structurally unusable: missing required values, unknown pay type,
 * a pay date outside the resolved tax year, mixed-employee row sets.
 */
public class InvalidInputException extends PayrollTaxException {

    public InvalidInputException(String field, String message) {
        super(ErrorKind.INVALID_INPUT, field, message);
    }
}
