package com.payroll.taxengine.config;

import com.payroll.taxengine.error.UnsupportedFilingStatusException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully resolved parameters for one (tax year, pay frequency). Immutable; safe to share
 * across threads once loaded.
 */
public final class TaxYearConfig {

    private final int year;
    private final String payFrequency;
    private final int periodsPerYear;
    private final ConfigSource source;
    private final StatutoryRates rates;
    private final Map<String, FitTable> fitTables;

    public TaxYearConfig(int year, String payFrequency, int periodsPerYear, ConfigSource source,
                         StatutoryRates rates, Map<String, FitTable> fitTables) {
        this.year = year;
        this.payFrequency = Objects.requireNonNull(payFrequency, "payFrequency");
        this.periodsPerYear = periodsPerYear;
        this.source = Objects.requireNonNull(source, "source");
        this.rates = Objects.requireNonNull(rates, "rates");
        this.fitTables = Collections.unmodifiableMap(new LinkedHashMap<>(fitTables));
    }

    public int getYear() { return year; }
    public String getPayFrequency() { return payFrequency; }
    public int getPeriodsPerYear() { return periodsPerYear; }
    public ConfigSource getSource() { return source; }
    public StatutoryRates getRates() { return rates; }
    public Map<String, FitTable> getFitTables() { return fitTables; }

    public List<String> getFilingStatuses() {
        return List.copyOf(fitTables.keySet());
    }

    public FitTable fitTable(String filingStatus) {
        FitTable table = filingStatus == null ? null : fitTables.get(filingStatus);
        if (table == null) {
            throw new UnsupportedFilingStatusException(filingStatus, year, fitTables.keySet());
        }
        return table;
    }

    public ConfigStamp stamp() {
        return new ConfigStamp(year, payFrequency, source.getVersion(), source.getPublication(),
            source.getEffectiveDate());
    }
}
