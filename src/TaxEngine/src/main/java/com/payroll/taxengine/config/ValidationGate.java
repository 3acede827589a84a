package com.payroll.taxengine.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a loaded tax year against its invariants before any calculation may use it:
 * metadata sanity, rates within [0, 1], non-negative bases and thresholds, well-formed
 * bracket tables, and the recorded year checkpoints from {@code validation.json}.
 */
public class ValidationGate {

    private static final Set<String> METHODS = Set.of("percentage", "wage_bracket");
    private static final BigDecimal CENT = new BigDecimal("0.01");
    private static final int CHECKPOINT_BRACKETS = 3;

    public ValidationResult validate(LoadedTaxYear loaded, int requestedYear) {
        TaxYearConfig config = loaded.getConfig();
        ValidationResult.Builder result = ValidationResult.builder();

        checkMetadata(config.getSource(), requestedYear, result);
        checkRates(config.getRates(), result);
        checkPeriods(config, result);
        for (FitTable table : config.getFitTables().values()) {
            checkBrackets(config.getPayFrequency(), table, result);
        }

        Map<String, Object> checkpoints = new LinkedHashMap<>();
        ValidationExpectations expectations = loaded.getExpectations();
        if (expectations == null) {
            result.fail(TaxYearConfigLoader.VALIDATION_FILE, "missing; year checkpoints cannot be verified");
        } else {
            if (expectations.getDeclaredTaxYear() != requestedYear) {
                result.fail("validation.tax_year", "tax_year mismatch: expected " + requestedYear
                    + ", found " + expectations.getDeclaredTaxYear());
            }
            for (FitTable table : config.getFitTables().values()) {
                checkpoints.put(table.getFilingStatus(),
                    checkCheckpoints(config.getPayFrequency(), table, expectations, result));
            }
        }

        result.detail("year", requestedYear)
            .detail("pay_frequency", config.getPayFrequency())
            .detail("version", config.getSource().getVersion())
            .detail("checked_files", loaded.getCheckedFiles())
            .detail("filing_status_checks", checkpoints);
        return result.build();
    }

    private void checkMetadata(ConfigSource source, int requestedYear, ValidationResult.Builder result) {
        if (source.getDeclaredTaxYear() != requestedYear) {
            result.fail("metadata.tax_year", "tax_year mismatch: expected " + requestedYear
                + ", found " + source.getDeclaredTaxYear());
        }
        requireNonBlank("metadata.source", source.getPublication(), result);
        requireNonBlank("metadata.version", source.getVersion(), result);
        requireNonBlank("metadata.notes", source.getNotes(), result);
        if (!METHODS.contains(source.getMethod())) {
            result.fail("metadata.method", "must be one of: percentage, wage_bracket");
        } else if (source.getNotes() != null && source.getNotes().toLowerCase().contains("percentage")
            && !"percentage".equals(source.getMethod())) {
            result.fail("metadata.method", "must be 'percentage' when notes indicate percentage tables");
        }
    }

    private void checkRates(StatutoryRates rates, ValidationResult.Builder result) {
        requireRate("rates.social_security.employee_rate", rates.getSocialSecurityEmployeeRate(), result);
        requireRate("rates.social_security.employer_rate", rates.getSocialSecurityEmployerRate(), result);
        requireRate("rates.medicare.employee_rate", rates.getMedicareEmployeeRate(), result);
        requireRate("rates.medicare.employer_rate", rates.getMedicareEmployerRate(), result);
        requireRate("rates.medicare.additional_employee_rate", rates.getAdditionalMedicareRate(), result);
        requireRate("rates.futa.employer_rate", rates.getFutaRate(), result);
        requireWageBase("rates.social_security.wage_base", rates.getSocialSecurityWageBase(), result);
        requireWageBase("rates.medicare.additional_threshold", rates.getAdditionalMedicareThreshold(), result);
        requireWageBase("rates.futa.wage_base", rates.getFutaWageBase(), result);
        requireWageBase("rates.suta.wage_base", rates.getSutaWageBase(), result);
    }

    private void checkPeriods(TaxYearConfig config, ValidationResult.Builder result) {
        if (config.getPeriodsPerYear() <= 0) {
            result.fail("fit." + config.getPayFrequency() + ".periods_per_year",
                "must be positive (was " + config.getPeriodsPerYear() + ")");
        }
    }

    private void checkBrackets(String payFrequency, FitTable table, ValidationResult.Builder result) {
        String prefix = "fit." + payFrequency + "." + table.getFilingStatus();
        if (table.getStandardDeduction().signum() < 0) {
            result.fail(prefix + ".standard_deduction", "must not be negative");
        }
        List<FitBracket> brackets = table.getBrackets();
        if (brackets.isEmpty()) {
            result.fail(prefix + ".brackets", "must contain at least one bracket");
            return;
        }
        if (brackets.get(0).getOver().signum() != 0) {
            result.fail(prefix + ".brackets[0].over", "first bracket must start at 0 (was "
                + brackets.get(0).getOver().toPlainString() + ")");
        }
        for (int i = 0; i < brackets.size(); i++) {
            FitBracket bracket = brackets.get(i);
            String field = prefix + ".brackets[" + i + "]";
            requireRate(field + ".rate", bracket.getRate(), result);
            if (bracket.getBaseTax().signum() < 0) {
                result.fail(field + ".base_tax", "must not be negative");
            }
            if (i == 0) continue;
            FitBracket previous = brackets.get(i - 1);
            if (bracket.getOver().compareTo(previous.getOver()) <= 0) {
                result.fail(field + ".over", "lower bounds must be strictly increasing ("
                    + previous.getOver().toPlainString() + " then " + bracket.getOver().toPlainString() + ")");
                continue;
            }
            BigDecimal expectedBase = previous.getBaseTax()
                .add(previous.getRate().multiply(bracket.getOver().subtract(previous.getOver())));
            if (expectedBase.subtract(bracket.getBaseTax()).abs().compareTo(CENT) >= 0) {
                result.fail(field + ".base_tax", "not continuous with the previous bracket (expected "
                    + expectedBase.setScale(2, RoundingMode.HALF_UP).toPlainString() + ", found "
                    + bracket.getBaseTax().toPlainString() + ")");
            }
        }
    }

    private Map<String, Object> checkCheckpoints(String payFrequency, FitTable table,
                                                 ValidationExpectations expectations,
                                                 ValidationResult.Builder result) {
        String status = table.getFilingStatus();
        String prefix = "fit." + payFrequency + "." + status;
        Map<String, Object> details = new LinkedHashMap<>();

        BigDecimal expectedDeduction = expectations.getStandardDeductions().get(status);
        details.put("standard_deduction", pair(expectedDeduction, table.getStandardDeduction()));
        if (expectedDeduction != null && expectedDeduction.compareTo(table.getStandardDeduction()) != 0) {
            result.fail(prefix + ".standard_deduction",
                "Tax tables appear to be for a different year (expected standard deduction "
                    + expectedDeduction.toPlainString() + ", found "
                    + table.getStandardDeduction().toPlainString() + ")");
        }

        // thresholds are the lower bounds of the brackets after the zero bracket
        List<FitBracket> brackets = table.getBrackets();
        if (brackets.isEmpty()) {
            return details;
        }
        List<BigDecimal> expected = expectations.getBracketThresholds().getOrDefault(status, List.of());
        int checks = Math.min(CHECKPOINT_BRACKETS, Math.min(expected.size(), brackets.size() - 1));
        List<Map<String, Object>> compared = new ArrayList<>();
        for (int i = 0; i < checks; i++) {
            BigDecimal actual = brackets.get(i + 1).getOver();
            Map<String, Object> check = pair(expected.get(i), actual);
            check.put("index", i);
            compared.add(check);
            if (expected.get(i).compareTo(actual) != 0) {
                result.fail(prefix + ".brackets[" + (i + 1) + "].over",
                    "Tax tables appear to be for a different year (expected bracket threshold "
                        + expected.get(i).toPlainString() + ", found " + actual.toPlainString() + ")");
            }
        }
        details.put("bracket_threshold_checks", compared);

        BigDecimal expectedTop = expectations.getTopBracketThresholds().get(status);
        BigDecimal actualTop = brackets.get(brackets.size() - 1).getOver();
        details.put("top_bracket_threshold", pair(expectedTop, actualTop));
        if (expectedTop != null && expectedTop.compareTo(actualTop) != 0) {
            result.fail(prefix + ".brackets[" + (brackets.size() - 1) + "].over",
                "Tax tables appear to be for a different year (expected top bracket threshold "
                    + expectedTop.toPlainString() + ", found " + actualTop.toPlainString() + ")");
        }
        return details;
    }

    private static Map<String, Object> pair(BigDecimal expected, BigDecimal actual) {
        Map<String, Object> pair = new LinkedHashMap<>();
        pair.put("expected", expected == null ? null : expected.toPlainString());
        pair.put("actual", actual.toPlainString());
        return pair;
    }

    private static void requireNonBlank(String field, String value, ValidationResult.Builder result) {
        if (value == null || value.isBlank()) {
            result.fail(field, "must not be empty");
        }
    }

    private static void requireRate(String field, BigDecimal rate, ValidationResult.Builder result) {
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            result.fail(field, "rate must be within [0, 1] (was " + rate.toPlainString() + ")");
        }
    }

    private static void requireWageBase(String field, BigDecimal amount, ValidationResult.Builder result) {
        if (amount.signum() < 0) {
            result.fail(field, "must not be negative (was " + amount.toPlainString() + ")");
        } else if (amount.signum() == 0) {
            result.warn(field + " is zero");
        }
    }
}
