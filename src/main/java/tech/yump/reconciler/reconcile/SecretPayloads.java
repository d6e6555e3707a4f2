package tech.yump.reconciler.reconcile;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encoding of secret values into the base64 form stored in a secret's data map.
 */
public final class SecretPayloads {

    private SecretPayloads() {
    }

    public static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the input is not valid base64
     */
    public static String decode(String encoded) {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
