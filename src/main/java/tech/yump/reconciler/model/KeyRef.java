package tech.yump.reconciler.model;

/**
 * Identifies a key within a secret, e.g. {@code postgres-credentials/postgres-password}.
 */
public record KeyRef(String secretName, String keyName) {

    @Override
    public String toString() {
        return secretName + "/" + keyName;
    }
}
