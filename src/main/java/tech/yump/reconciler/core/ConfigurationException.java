package tech.yump.reconciler.core;

/**
 * Raised when the declared secret schema is malformed. Always fatal, always before any resolution.
 */
public class ConfigurationException extends ReconcilerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
