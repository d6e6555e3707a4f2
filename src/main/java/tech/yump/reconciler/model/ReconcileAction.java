package tech.yump.reconciler.model;

/**
 * Outcome of reconciling a single secret.
 */
public enum ReconcileAction {
    CREATED("Created"),
    UPDATED("Updated"),
    UNCHANGED("Unchanged"),
    FAILED("Failed"),
    /** Reference handed to the external store; materialization is asynchronous. */
    SUBMITTED("Submitted");

    private final String label;

    ReconcileAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
