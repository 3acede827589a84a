package com.payroll.taxengine.config;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Checkpoints from {@code validation.json}, recorded per year to catch a table file
 * from the wrong year. Not a re-derivation of the tables.
 */
public final class ValidationExpectations {

    private final int declaredTaxYear;
    private final Map<String, BigDecimal> standardDeductions;
    private final Map<String, List<BigDecimal>> bracketThresholds;
    private final Map<String, BigDecimal> topBracketThresholds;

    public ValidationExpectations(int declaredTaxYear,
                                  Map<String, BigDecimal> standardDeductions,
                                  Map<String, List<BigDecimal>> bracketThresholds,
                                  Map<String, BigDecimal> topBracketThresholds) {
        this.declaredTaxYear = declaredTaxYear;
        this.standardDeductions = Map.copyOf(standardDeductions);
        this.bracketThresholds = Map.copyOf(bracketThresholds);
        this.topBracketThresholds = Map.copyOf(topBracketThresholds);
    }

    public int getDeclaredTaxYear() { return declaredTaxYear; }
    public Map<String, BigDecimal> getStandardDeductions() { return standardDeductions; }
    public Map<String, List<BigDecimal>> getBracketThresholds() { return bracketThresholds; }
    public Map<String, BigDecimal> getTopBracketThresholds() { return topBracketThresholds; }
}
