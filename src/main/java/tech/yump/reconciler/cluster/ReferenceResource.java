package tech.yump.reconciler.cluster;

import java.util.Map;

/**
 * A declaratively applied custom resource of the external secret-store integration.
 *
 * @param apiVersion group/version, e.g. {@code external-secrets.io/v1beta1}
 * @param kind       resource kind
 * @param name       resource name
 * @param namespace  owning namespace, {@code null} for cluster-scoped kinds
 * @param labels     resource labels
 * @param spec       the resource spec; holds references only, never values
 */
public record ReferenceResource(
        String apiVersion,
        String kind,
        String name,
        String namespace,
        Map<String, String> labels,
        Map<String, Object> spec
) {

    public boolean namespaced() {
        return namespace != null;
    }
}
