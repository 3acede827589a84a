package com.payroll.taxengine.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payroll.taxengine.error.ValidationFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PASS, or a list of field-tagged FAIL reasons. Warnings never fail a result.
 * Instances are immutable; use {@link #builder()} to collect checks.
 */
@JsonPropertyOrder({"status", "failures", "warnings", "details"})
public final class ValidationResult {

    private final List<ValidationFailure> failures;
    private final List<String> warnings;
    private final Map<String, Object> details;

    private ValidationResult(List<ValidationFailure> failures, List<String> warnings, Map<String, Object> details) {
        this.failures = List.copyOf(failures);
        this.warnings = List.copyOf(warnings);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPassed() {
        return failures.isEmpty();
    }

    @JsonProperty("status")
    public String getStatus() {
        return isPassed() ? "PASS" : "FAIL";
    }

    @JsonProperty("failures")
    public List<ValidationFailure> getFailures() { return failures; }

    @JsonProperty("warnings")
    public List<String> getWarnings() { return warnings; }

    @JsonProperty("details")
    public Map<String, Object> getDetails() { return details; }

    public boolean hasFailureFor(String field) {
        return failures.stream().anyMatch(f -> f.getField().equals(field));
    }

    @Override
    public String toString() {
        return getStatus() + (failures.isEmpty() ? "" : " " + failures);
    }

    public static final class Builder {
        private final List<ValidationFailure> failures = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder() {}

        public Builder fail(String field, String message) {
            failures.add(new ValidationFailure(field, message));
            return this;
        }

        public Builder warn(String message) {
            warnings.add(message);
            return this;
        }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public Builder merge(ValidationResult other) {
            failures.addAll(other.failures);
            warnings.addAll(other.warnings);
            details.putAll(other.details);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(failures, warnings, details);
        }
    }
}
