package tech.yump.reconciler.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.reconciler.audit.AuditEvent;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.cluster.ClusterException;
import tech.yump.reconciler.cluster.ConnectivityException;
import tech.yump.reconciler.cluster.PermissionException;
import tech.yump.reconciler.cluster.ReferenceResource;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.config.ReconcilerProperties.StoreKind;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.SecretSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alternative to {@link tech.yump.reconciler.reconcile.SecretReconciler} for deployments whose credentials
 * live in an external store. Instead of literal values it applies references: one store-connection
 * definition and one {@code ExternalSecret} per declared secret. The external synchronizer materializes
 * the native secrets asynchronously, so every result is {@link ReconcileAction#SUBMITTED}.
 */
@Slf4j
@Component
public class ExternalBackendAdapter {

    public static final String EXTERNAL_SECRET_KIND = "ExternalSecret";
    static final String CREATION_POLICY = "Owner";

    private final ClusterApi clusterApi;
    private final ReconcilerProperties properties;
    private final AuditHelper auditHelper;

    public ExternalBackendAdapter(ClusterApi clusterApi, ReconcilerProperties properties, AuditHelper auditHelper) {
        this.clusterApi = clusterApi;
        this.properties = properties;
        this.auditHelper = auditHelper;
    }

    /**
     * Applies the store connection and the per-secret references.
     *
     * @throws ClusterException if the store connection cannot be applied; no reference is submitted then.
     */
    public List<ReconciliationResult> submit(String namespace, List<SecretSpec> specs) {
        ReferenceResource store = storeConnection(namespace);
        log.info("Applying {} '{}'", store.kind(), store.name());
        clusterApi.applyReference(store);
        auditReference(store, "applied", null);

        List<ReconciliationResult> results = new ArrayList<>();
        for (SecretSpec spec : specs) {
            results.add(submitOne(spec));
        }
        return results;
    }

    /**
     * Dry-run counterpart of {@link #submit}: builds the references without applying them.
     */
    public List<ReconciliationResult> plan(String namespace, List<SecretSpec> specs) {
        ReferenceResource store = storeConnection(namespace);
        log.info("[dry-run] Would apply {} '{}'", store.kind(), store.name());
        List<ReconciliationResult> results = new ArrayList<>();
        for (SecretSpec spec : specs) {
            ReferenceResource reference = externalSecret(spec);
            log.info("[dry-run] Would apply {} '{}' mapping keys {}", reference.kind(), reference.name(), spec.keyNames());
            results.add(ReconciliationResult.planned(spec.name(), ReconcileAction.SUBMITTED));
        }
        return results;
    }

    private ReconciliationResult submitOne(SecretSpec spec) {
        ReferenceResource reference = externalSecret(spec);
        try {
            clusterApi.applyReference(reference);
            log.info("Secret '{}': submitted as {} referencing store '{}'", spec.name(), EXTERNAL_SECRET_KIND, storeName());
            auditReference(reference, "submitted", null);
            return ReconciliationResult.of(spec.name(), ReconcileAction.SUBMITTED);
        } catch (ConnectivityException | PermissionException e) {
            auditReference(reference, "failure", e.getMessage());
            throw e;
        } catch (ClusterException e) {
            log.error("Secret '{}': reference could not be applied: {}", spec.name(), e.getMessage());
            auditReference(reference, "failure", e.getMessage());
            return ReconciliationResult.failed(spec.name(), e.getMessage());
        }
    }

    ReferenceResource storeConnection(String namespace) {
        ReconcilerProperties.ExternalProperties external = properties.external();
        boolean clusterWide = external.storeKind() == StoreKind.CLUSTER_SECRET_STORE;
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("provider", external.provider());
        return new ReferenceResource(
                external.apiVersion(),
                external.storeKind().kind(),
                storeName(),
                clusterWide ? null : namespace,
                ownerLabels(storeName()),
                spec);
    }

    ReferenceResource externalSecret(SecretSpec secret) {
        ReconcilerProperties.ExternalProperties external = properties.external();

        Map<String, Object> storeRef = new LinkedHashMap<>();
        storeRef.put("name", storeName());
        storeRef.put("kind", external.storeKind().kind());

        // The materialized secret carries the same managed labels a natively reconciled one would
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("name", secret.name());
        target.put("creationPolicy", CREATION_POLICY);
        target.put("template", Map.of("metadata", Map.of("labels", new LinkedHashMap<>(secret.managedLabels()))));

        List<Map<String, Object>> data = new ArrayList<>();
        for (KeySpec key : secret.keys()) {
            Map<String, Object> remoteRef = new LinkedHashMap<>();
            remoteRef.put("key", key.remoteKey());
            if (StringUtils.hasText(key.remoteProperty())) {
                remoteRef.put("property", key.remoteProperty());
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("secretKey", key.keyName());
            entry.put("remoteRef", remoteRef);
            data.add(entry);
        }

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("refreshInterval", formatInterval(external.refreshInterval()));
        spec.put("secretStoreRef", storeRef);
        spec.put("target", target);
        spec.put("data", data);

        return new ReferenceResource(external.apiVersion(), EXTERNAL_SECRET_KIND, secret.name(), secret.namespace(),
                new LinkedHashMap<>(secret.managedLabels()), spec);
    }

    private String storeName() {
        return properties.external().storeName();
    }

    private Map<String, String> ownerLabels(String name) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ManagedLabels.NAME, name);
        labels.put(ManagedLabels.MANAGED_BY, properties.managedBy());
        labels.put(ManagedLabels.CREATED_BY, properties.createdBy());
        return labels;
    }

    /**
     * Formats a duration the way the synchronizer expects it, e.g. {@code 1h}, {@code 15m}, {@code 90s}.
     */
    static String formatInterval(Duration interval) {
        long seconds = interval.toSeconds();
        if (seconds > 0 && seconds % 3600 == 0) {
            return seconds / 3600 + "h";
        }
        if (seconds > 0 && seconds % 60 == 0) {
            return seconds / 60 + "m";
        }
        return seconds + "s";
    }

    private void auditReference(ReferenceResource reference, String outcome, String error) {
        auditHelper.logEvent("reference_operation", "apply", outcome,
                AuditEvent.TargetInfo.builder()
                        .namespace(reference.namespace())
                        .kind(reference.kind())
                        .name(reference.name())
                        .build(),
                error, null);
    }
}
