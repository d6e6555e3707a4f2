package tech.yump.reconciler.core;

import java.util.Map;

/**
 * Label keys stamped on every resource this tool owns, so later runs and other tooling can discover them.
 */
public final class ManagedLabels {

    public static final String NAME = "app.kubernetes.io/name";
    public static final String MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String CREATED_BY = "app.kubernetes.io/created-by";
    public static final String ENVIRONMENT = "environment";

    private ManagedLabels() {
    }

    /**
     * Selector matching everything managed by the given owner.
     */
    public static Map<String, String> selector(String managedBy) {
        return Map.of(MANAGED_BY, managedBy);
    }
}
