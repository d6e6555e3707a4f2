package tech.yump.reconciler.core;

/**
 * Process exit statuses of a reconcile run, ordered from best to worst.
 */
public enum ExitStatus {
    SUCCESS(0),
    VALIDATION_FAILURE(1),
    CLUSTER_FAILURE(2),
    PARTIAL_FAILURE(3);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns the more severe of the two statuses. Severity follows declaration order.
     */
    public ExitStatus worst(ExitStatus other) {
        return other.ordinal() > this.ordinal() ? other : this;
    }
}
