package tech.yump.reconciler.schema;

import tech.yump.reconciler.core.ReconcilerException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when resolved values break their format or length rules. Blocks every mutation of the run.
 */
public class ValidationException extends ReconcilerException {

    private final List<KeyValidationOutcome> failures;

    public ValidationException(List<KeyValidationOutcome> failures) {
        super("Invalid values: " + failures.stream().map(KeyValidationOutcome::toString).collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
    }

    public List<KeyValidationOutcome> getFailures() {
        return failures;
    }
}
