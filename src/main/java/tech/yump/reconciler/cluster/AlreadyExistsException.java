package tech.yump.reconciler.cluster;

/**
 * A create was rejected because the resource already exists.
 */
public class AlreadyExistsException extends ClusterException {

    public AlreadyExistsException(String message) {
        super(message);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
