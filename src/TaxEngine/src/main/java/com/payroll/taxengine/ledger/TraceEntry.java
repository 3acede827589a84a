package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a calculation: what was computed, from which inputs, the value before and
 * after rounding, and which rounding was applied. Inputs are plain-string decimals in
 * insertion order so a trace serializes identically every time.
 */
@JsonPropertyOrder({"step", "formula", "inputs", "raw_value", "value", "rounding"})
public final class TraceEntry {

    private final String step;
    private final String formula;
    private final Map<String, String> inputs;
    private final BigDecimal rawValue;
    private final BigDecimal value;
    private final RoundingApplied rounding;

    @JsonCreator
    public TraceEntry(@JsonProperty("step") String step,
                      @JsonProperty("formula") String formula,
                      @JsonProperty("inputs") Map<String, String> inputs,
                      @JsonProperty("raw_value") BigDecimal rawValue,
                      @JsonProperty("value") BigDecimal value,
                      @JsonProperty("rounding") RoundingApplied rounding) {
        this.step = Objects.requireNonNull(step, "step");
        this.formula = formula;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs == null ? Map.of() : inputs));
        this.rawValue = rawValue;
        this.value = value;
        this.rounding = rounding;
    }

    @JsonProperty("step")
    public String getStep() { return step; }

    @JsonProperty("formula")
    public String getFormula() { return formula; }

    @JsonProperty("inputs")
    public Map<String, String> getInputs() { return inputs; }

    @JsonProperty("raw_value")
    public BigDecimal getRawValue() { return rawValue; }

    @JsonProperty("value")
    public BigDecimal getValue() { return value; }

    @JsonProperty("rounding")
    public RoundingApplied getRounding() { return rounding; }

    public String input(String name) {
        return inputs.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEntry)) return false;
        TraceEntry that = (TraceEntry) o;
        return step.equals(that.step)
            && Objects.equals(formula, that.formula)
            && inputs.equals(that.inputs)
            && Objects.equals(rawValue, that.rawValue)
            && Objects.equals(value, that.value)
            && rounding == that.rounding;
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, formula, inputs, rawValue, value, rounding);
    }

    @Override
    public String toString() {
        return step + " = " + (value == null ? "null" : value.toPlainString())
            + " [" + formula + "; " + rounding + "]";
    }
}
