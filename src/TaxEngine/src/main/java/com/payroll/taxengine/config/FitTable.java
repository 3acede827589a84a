package com.payroll.taxengine.config;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Annual percentage-method table for one filing status.
 */
public final class FitTable {

    private final String filingStatus;
    private final BigDecimal standardDeduction;
    private final List<FitBracket> brackets;

    public FitTable(String filingStatus, BigDecimal standardDeduction, List<FitBracket> brackets) {
        this.filingStatus = Objects.requireNonNull(filingStatus, "filingStatus");
        this.standardDeduction = Objects.requireNonNull(standardDeduction, "standardDeduction");
        this.brackets = List.copyOf(brackets);
    }

    public String getFilingStatus() { return filingStatus; }
    public BigDecimal getStandardDeduction() { return standardDeduction; }
    public List<FitBracket> getBrackets() { return brackets; }

    /**
     * Index of the largest bracket whose lower bound is at or below {@code annualAmount},
     * or -1 when the amount sits below the first bound.
     */
    public int bracketIndexFor(BigDecimal annualAmount) {
        int selected = -1;
        for (int i = 0; i < brackets.size(); i++) {
            if (brackets.get(i).getOver().compareTo(annualAmount) <= 0) {
                selected = i;
            } else {
                break;
            }
        }
        return selected;
    }
}
