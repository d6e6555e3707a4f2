package tech.yump.reconciler.env;

import tech.yump.reconciler.model.KeySpec;

import java.security.SecureRandom;

/**
 * Generates random values for keys explicitly declared as generatable.
 */
public class ValueGenerator {

    static final int DEFAULT_LENGTH = 32;
    // Alphanumeric only, so generated values survive URLs, connection strings and shells unescaped
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom random;

    public ValueGenerator() {
        this(new SecureRandom());
    }

    public ValueGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate(KeySpec key) {
        int length = Math.max(DEFAULT_LENGTH, key.validation().minLengthRule().orElse(0));
        StringBuilder value = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            value.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return value.toString();
    }
}
