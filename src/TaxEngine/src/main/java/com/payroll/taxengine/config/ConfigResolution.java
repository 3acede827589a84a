package com.payroll.taxengine.config;

import com.payroll.taxengine.error.ConfigInvalidException;

/**
 * Outcome of {@link TaxYearConfigRepository#resolve}: the parsed config together with
 * the validation gate's verdict on it. A FAIL config must not be used for calculation.
 */
public final class ConfigResolution {

    private final TaxYearConfig config;
    private final ValidationResult validation;

    public ConfigResolution(TaxYearConfig config, ValidationResult validation) {
        this.config = config;
        this.validation = validation;
    }

    public TaxYearConfig getConfig() { return config; }
    public ValidationResult getValidation() { return validation; }

    public boolean isPassed() {
        return validation.isPassed();
    }

    /**
     * Returns the config if the gate passed it.
     *
     * @throws ConfigInvalidException carrying every FAIL reason otherwise
     */
    public TaxYearConfig requirePassed() {
        if (!validation.isPassed()) {
            throw new ConfigInvalidException(config.getYear(), config.getPayFrequency(), validation.getFailures());
        }
        return config;
    }
}
