package com.payroll.taxengine.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ordered record of every step of one payroll computation. Replaying the steps against
 * the same inputs and configuration reproduces the row exactly.
 */
public final class CalculationTrace {

    private final List<TraceEntry> entries;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public CalculationTrace(List<TraceEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    @JsonValue
    public List<TraceEntry> getEntries() {
        return entries;
    }

    public Optional<TraceEntry> find(String step) {
        return entries.stream().filter(e -> e.getStep().equals(step)).findFirst();
    }

    /** Rounded value of a step. */
    public BigDecimal valueOf(String step) {
        return find(step)
            .map(TraceEntry::getValue)
            .orElseThrow(() -> new IllegalArgumentException("No trace step '" + step + "'"));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalculationTrace)) return false;
        return entries.equals(((CalculationTrace) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
