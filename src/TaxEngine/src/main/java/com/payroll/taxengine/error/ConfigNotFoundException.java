package com.payroll.taxengine.error;

/**
 * The tax-year directory, or the FIT table for a configured frequency, is absent.
 * Never answered with a fallback year.
 */
public class ConfigNotFoundException extends PayrollTaxException {

    private final int year;
    private final String payFrequency;

    public ConfigNotFoundException(int year, String payFrequency, String location) {
        super(ErrorKind.CONFIG_NOT_FOUND, location, payFrequency == null
            ? "Missing tax configuration for year " + year + " (" + location + ")"
            : "Missing tax configuration for year " + year + ", frequency '" + payFrequency
                + "' (" + location + ")");
        this.year = year;
        this.payFrequency = payFrequency;
    }

    public int getYear() { return year; }

    /** Null when the whole year is missing rather than a single frequency table. */
    public String getPayFrequency() { return payFrequency; }
}
