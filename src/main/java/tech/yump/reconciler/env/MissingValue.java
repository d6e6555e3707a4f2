package tech.yump.reconciler.env;

import tech.yump.reconciler.model.KeyRef;

/**
 * A required key that no source could provide.
 */
public record MissingValue(KeyRef ref, String sourceVar) {

    @Override
    public String toString() {
        return ref + " (" + sourceVar + ")";
    }
}
