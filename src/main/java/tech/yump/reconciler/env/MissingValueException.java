package tech.yump.reconciler.env;

import tech.yump.reconciler.core.ReconcilerException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when one or more required values could not be resolved. Carries every miss of the run.
 */
public class MissingValueException extends ReconcilerException {

    private final List<MissingValue> missing;

    public MissingValueException(List<MissingValue> missing) {
        super("Missing required values: " + missing.stream().map(MissingValue::toString).collect(Collectors.joining(", ")));
        this.missing = List.copyOf(missing);
    }

    public List<MissingValue> getMissing() {
        return missing;
    }
}
