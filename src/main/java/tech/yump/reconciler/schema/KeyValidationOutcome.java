package tech.yump.reconciler.schema;

import tech.yump.reconciler.model.KeyRef;

import java.util.List;

/**
 * Pass/fail of one key against its rules. Violations describe the rule, never the value.
 */
public record KeyValidationOutcome(KeyRef ref, List<String> violations) {

    public KeyValidationOutcome {
        violations = List.copyOf(violations);
    }

    public boolean valid() {
        return violations.isEmpty();
    }

    @Override
    public String toString() {
        return valid() ? ref + ": ok" : ref + ": " + String.join("; ", violations);
    }
}
