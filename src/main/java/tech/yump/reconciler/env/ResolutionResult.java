package tech.yump.reconciler.env;

import tech.yump.reconciler.model.ResolvedValues;

import java.util.List;

/**
 * Outcome of resolving a set of keys: the values found and every key that had no source.
 */
public record ResolutionResult(ResolvedValues values, List<MissingValue> missing) {

    public ResolutionResult {
        missing = List.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }

    /**
     * Returns the values, or throws a {@link MissingValueException} naming all misses.
     */
    public ResolvedValues valuesOrThrow() {
        if (!isComplete()) {
            throw new MissingValueException(missing);
        }
        return values;
    }
}
