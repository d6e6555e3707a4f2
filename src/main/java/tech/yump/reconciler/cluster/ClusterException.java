package tech.yump.reconciler.cluster;

import tech.yump.reconciler.core.ReconcilerException;

/**
 * Failure reported by the orchestrator resource API that is neither connectivity, permission nor conflict.
 */
public class ClusterException extends ReconcilerException {

    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
