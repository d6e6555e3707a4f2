package tech.yump.reconciler.cluster;

/**
 * An update was rejected because the resource changed since it was read. Retryable.
 */
public class ConflictException extends ClusterException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
