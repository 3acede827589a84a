package com.payroll.taxengine.calc;

import com.payroll.taxengine.ledger.CalculationTrace;
import com.payroll.taxengine.ledger.RoundingApplied;
import com.payroll.taxengine.ledger.TraceEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects trace entries in computation order. Each recording method returns the value it
 * recorded so steps chain directly into the next formula.
 */
final class TraceRecorder {

    private final List<TraceEntry> entries = new ArrayList<>();

    /** Records a value that needs no rounding. */
    BigDecimal exact(String step, String formula, Map<String, String> inputs, BigDecimal value) {
        entries.add(new TraceEntry(step, formula, inputs, value, value, RoundingApplied.NONE));
        return value;
    }

    /** Records {@code raw} rounded HALF_UP to cents. */
    BigDecimal cents(String step, String formula, Map<String, String> inputs, BigDecimal raw) {
        BigDecimal value = Money.cents(raw);
        entries.add(new TraceEntry(step, formula, inputs, raw, value, RoundingApplied.HALF_UP_CENTS));
        return value;
    }

    /** Records a division carried to the intermediate scale. */
    BigDecimal divide(String step, String formula, Map<String, String> inputs,
                      BigDecimal dividend, BigDecimal divisor) {
        BigDecimal value = Money.divide(dividend, divisor);
        entries.add(new TraceEntry(step, formula, inputs, value, value, RoundingApplied.HALF_UP_INTERMEDIATE));
        return value;
    }

    CalculationTrace build() {
        return new CalculationTrace(entries);
    }

    /** Alternating name/value pairs; decimals are written in plain notation. */
    static Map<String, String> inputs(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("inputs need name/value pairs");
        }
        Map<String, String> inputs = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Object value = namesAndValues[i + 1];
            inputs.put(String.valueOf(namesAndValues[i]),
                value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : String.valueOf(value));
        }
        return inputs;
    }
}
