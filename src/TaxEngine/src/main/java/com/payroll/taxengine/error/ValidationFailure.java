package com.payroll.taxengine.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One failed check, tagged with the field (or file/field path) that caused it.
 */
public final class ValidationFailure {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("message")
    private final String message;

    @JsonCreator
    public ValidationFailure(@JsonProperty("field") String field,
                             @JsonProperty("message") String message) {
        this.field = Objects.requireNonNull(field, "field");
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getField() { return field; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationFailure)) return false;
        ValidationFailure that = (ValidationFailure) o;
        return field.equals(that.field) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
