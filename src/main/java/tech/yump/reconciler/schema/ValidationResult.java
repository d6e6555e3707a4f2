package tech.yump.reconciler.schema;

import java.util.List;

/**
 * Per-key outcomes of a validation pass plus the aggregated verdict.
 */
public record ValidationResult(List<KeyValidationOutcome> outcomes) {

    public ValidationResult {
        outcomes = List.copyOf(outcomes);
    }

    public boolean passed() {
        return outcomes.stream().allMatch(KeyValidationOutcome::valid);
    }

    public List<KeyValidationOutcome> failures() {
        return outcomes.stream().filter(o -> !o.valid()).toList();
    }

    public void throwIfFailed() {
        if (!passed()) {
            throw new ValidationException(failures());
        }
    }
}
