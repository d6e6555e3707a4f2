package tech.yump.reconciler.cluster;

/**
 * The orchestrator API could not be reached. Fatal to the whole run.
 */
public class ConnectivityException extends ClusterException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
