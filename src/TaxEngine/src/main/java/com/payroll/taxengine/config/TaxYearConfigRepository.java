package com.payroll.taxengine.config;

import com.payroll.taxengine.error.ConfigNotFoundException;
import com.payroll.taxengine.error.PayrollTaxException;
import com.payroll.taxengine.error.ValidationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves and validates tax-year configuration, caching each (year, frequency) for the
 * life of the process. Tax files do not change at runtime, so cached resolutions are
 * never invalidated. Concurrent first resolutions converge on equal immutable values.
 */
public class TaxYearConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(TaxYearConfigRepository.class);

    static final String DEFAULT_CLASSPATH_ROOT = "tax";

    private final TaxYearConfigLoader loader;
    private final ValidationGate gate;
    private final Map<String, ConfigResolution> cache = new ConcurrentHashMap<>();

    public TaxYearConfigRepository(TaxDataSource dataSource) {
        this(new TaxYearConfigLoader(dataSource), new ValidationGate());
    }

    public TaxYearConfigRepository(TaxYearConfigLoader loader, ValidationGate gate) {
        this.loader = loader;
        this.gate = gate;
    }

    /**
     * Uses the directory in {@code TAX_DATA_DIR} when set, otherwise the tables shipped on
     * the classpath under {@code tax/}.
     */
    public static TaxYearConfigRepository fromEnvironment() {
        String dir = System.getenv("TAX_DATA_DIR");
        if (dir != null && !dir.isBlank()) {
            log.info("Reading tax configuration from directory {}", dir);
            return new TaxYearConfigRepository(new DirectoryTaxDataSource(Path.of(dir)));
        }
        return new TaxYearConfigRepository(new ClasspathTaxDataSource(DEFAULT_CLASSPATH_ROOT));
    }

    /**
     * Resolves the configuration for {@code (year, payFrequency)} and runs it through the
     * validation gate.
     *
     * @throws ConfigNotFoundException when the year or the frequency table is absent
     * @throws com.payroll.taxengine.error.ConfigInvalidException when the files are malformed
     * @throws com.payroll.taxengine.error.UnsupportedFrequencyException when the year does not define the frequency
     */
    public ConfigResolution resolve(int year, String payFrequency) {
        Objects.requireNonNull(payFrequency, "payFrequency");
        return cache.computeIfAbsent(year + "/" + payFrequency, key -> load(year, payFrequency));
    }

    /**
     * Validates every frequency the year declares. Missing or malformed frequency tables
     * become FAIL reasons rather than exceptions so operators see the full picture.
     *
     * @throws ConfigNotFoundException when the year itself is absent
     */
    public ValidationResult validateYear(int year) {
        ConfigSource source = loader.loadSource(year);
        Set<ValidationFailure> failures = new LinkedHashSet<>();
        Set<String> warnings = new LinkedHashSet<>();
        Map<String, Object> frequencies = new LinkedHashMap<>();
        for (String frequency : source.getPayFrequencies()) {
            try {
                ValidationResult frequencyResult = resolve(year, frequency).getValidation();
                failures.addAll(frequencyResult.getFailures());
                warnings.addAll(frequencyResult.getWarnings());
                frequencies.put(frequency, frequencyResult.getStatus());
            } catch (PayrollTaxException e) {
                failures.addAll(e.getFailures());
                frequencies.put(frequency, e.getKind().name());
            }
        }

        ValidationResult.Builder result = ValidationResult.builder();
        failures.forEach(f -> result.fail(f.getField(), f.getMessage()));
        warnings.forEach(result::warn);
        result.detail("year", year)
            .detail("version", source.getVersion())
            .detail("pay_frequencies", frequencies);
        ValidationResult merged = result.build();
        log.info("Tax year {} validation: {} ({} failures, {} warnings)",
            year, merged.getStatus(), merged.getFailures().size(), merged.getWarnings().size());
        return merged;
    }

    private ConfigResolution load(int year, String payFrequency) {
        LoadedTaxYear loaded = loader.load(year, payFrequency);
        ValidationResult validation = gate.validate(loaded, year);
        if (validation.isPassed()) {
            log.info("Tax configuration {}/{} passed validation", year, payFrequency);
        } else {
            log.warn("Tax configuration {}/{} failed validation: {}", year, payFrequency, validation.getFailures());
        }
        return new ConfigResolution(loaded.getConfig(), validation);
    }
}
