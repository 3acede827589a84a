package com.payroll.taxengine.config;

import java.time.LocalDate;
import java.util.List;

/**
 * Contents of {@code metadata.json}: where the year's figures came from and which
 * frequencies and filing statuses the year defines.
 */
public final class ConfigSource {

    private final int declaredTaxYear;
    private final String publication;
    private final String version;
    private final LocalDate effectiveDate;
    private final String notes;
    private final String method;
    private final List<String> payFrequencies;
    private final List<String> filingStatuses;

    public ConfigSource(int declaredTaxYear, String publication, String version, LocalDate effectiveDate,
                        String notes, String method, List<String> payFrequencies, List<String> filingStatuses) {
        this.declaredTaxYear = declaredTaxYear;
        this.publication = publication;
        this.version = version;
        this.effectiveDate = effectiveDate;
        this.notes = notes;
        this.method = method;
        this.payFrequencies = List.copyOf(payFrequencies);
        this.filingStatuses = List.copyOf(filingStatuses);
    }

    public int getDeclaredTaxYear() { return declaredTaxYear; }
    public String getPublication() { return publication; }
    public String getVersion() { return version; }
    public LocalDate getEffectiveDate() { return effectiveDate; }
    public String getNotes() { return notes; }
    public String getMethod() { return method; }
    public List<String> getPayFrequencies() { return payFrequencies; }
    public List<String> getFilingStatuses() { return filingStatuses; }
}
