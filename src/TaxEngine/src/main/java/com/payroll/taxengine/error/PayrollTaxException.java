package com.payroll.taxengine.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base of the engine's failure taxonomy. Carries a kind and the field-level reasons so
 * callers can present them to the user without parsing the message.
 */
public class PayrollTaxException extends RuntimeException {

    private final ErrorKind kind;
    private final List<ValidationFailure> failures;

    public PayrollTaxException(ErrorKind kind, String message, List<ValidationFailure> failures) {
        super(message);
        this.kind = kind;
        this.failures = List.copyOf(failures);
    }

    public PayrollTaxException(ErrorKind kind, String field, String message) {
        this(kind, message, List.of(new ValidationFailure(field, message)));
    }

    public ErrorKind getKind() { return kind; }

    public List<ValidationFailure> getFailures() { return failures; }

    /** Message plus every field reason, one per line. */
    public String describe() {
        if (failures.isEmpty()) return getMessage();
        return getMessage() + failures.stream()
            .map(f -> "\n  - " + f)
            .collect(Collectors.joining());
    }
}
