package tech.yump.reconciler.model;

/**
 * Result of reconciling one secret. {@code error} is set only for {@link ReconcileAction#FAILED}
 * and never contains secret material.
 */
public record ReconciliationResult(String secretName, ReconcileAction action, String error, boolean dryRun) {

    public static ReconciliationResult of(String secretName, ReconcileAction action) {
        return new ReconciliationResult(secretName, action, null, false);
    }

    public static ReconciliationResult planned(String secretName, ReconcileAction action) {
        return new ReconciliationResult(secretName, action, null, true);
    }

    public static ReconciliationResult failed(String secretName, String error) {
        return new ReconciliationResult(secretName, ReconcileAction.FAILED, error, false);
    }

    public boolean isFailed() {
        return action == ReconcileAction.FAILED;
    }
}
