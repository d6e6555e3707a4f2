package tech.yump.reconciler.cluster;

/**
 * The ambient credentials are not allowed to perform an operation. Fatal to the whole run.
 */
public class PermissionException extends ClusterException {

    public PermissionException(String message) {
        super(message);
    }

    public PermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
