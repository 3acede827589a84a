package com.payroll.taxengine.model;

import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.error.NegativeInputRejectedException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Normalizes user-entered rates. A trailing {@code %} always means percent; a bare
 * number above 1 is read as percent, at or below 1 as a decimal.
 * <pre>
 *   "2.7"   -> 0.027
 *   "2.7%"  -> 0.027
 *   "0.027" -> 0.027
 *   "3"     -> 0.03
 * </pre>
 */
public final class RateParser {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private RateParser() {}

    public static BigDecimal parseRateToDecimal(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("rate", "Rate is required");
        }
        String trimmed = text.trim();
        boolean percentSuffix = trimmed.endsWith("%");
        if (percentSuffix) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        BigDecimal raw;
        try {
            raw = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("rate", "Rate must be a valid number (was '" + text + "')");
        }
        if (raw.signum() < 0) {
            throw new NegativeInputRejectedException("rate", raw);
        }
        if (percentSuffix || raw.compareTo(BigDecimal.ONE) > 0) {
            return raw.divide(HUNDRED).stripTrailingZeros();
        }
        return raw.stripTrailingZeros();
    }

    public static BigDecimal parseRateToDecimal(BigDecimal value) {
        return parseRateToDecimal(value.toPlainString());
    }

    /**
     * Parses a stored employer rate and requires the result to lie in [0, 1]. "150" reads as
     * 150% and is rejected under {@code field}.
     */
    public static BigDecimal parseEmployerRate(String field, BigDecimal value) {
        if (value == null) {
            throw new InvalidInputException(field, "Rate is required");
        }
        if (value.signum() < 0) {
            throw new NegativeInputRejectedException(field, value);
        }
        BigDecimal rate = parseRateToDecimal(value);
        if (rate.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidInputException(field, "Rate " + value.toPlainString()
                + " is above 100% after normalization");
        }
        return rate;
    }

    /** 0.027 -> "2.7%", 0.0315 -> "3.15%". */
    public static String formatPercent(BigDecimal rate) {
        BigDecimal percent = rate.multiply(HUNDRED).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
        return percent.toPlainString() + "%";
    }
}
