package tech.yump.reconciler.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Declarative rules a resolved value must satisfy. Both rules are optional.
 *
 * @param minLength minimum number of characters, or {@code null} for no minimum
 * @param pattern   pattern the whole value must match, or {@code null} for any format
 */
public record KeyValidation(Integer minLength, Pattern pattern) {

    public static final KeyValidation NONE = new KeyValidation(null, null);

    public Optional<Integer> minLengthRule() {
        return Optional.ofNullable(minLength);
    }

    public Optional<Pattern> patternRule() {
        return Optional.ofNullable(pattern);
    }

    @Override
    public String toString() {
        return "KeyValidation[minLength=" + minLength + ", pattern=" + (pattern == null ? null : pattern.pattern()) + "]";
    }
}
