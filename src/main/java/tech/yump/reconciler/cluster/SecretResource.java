package tech.yump.reconciler.cluster;

import java.util.Map;
import java.util.TreeSet;

/**
 * Orchestrator-neutral view of an opaque secret resource.
 *
 * @param name            resource name
 * @param namespace       owning namespace
 * @param data            base64-encoded values by data key
 * @param labels          resource labels
 * @param resourceVersion optimistic-concurrency token observed on read, {@code null} for a new resource
 */
public record SecretResource(
        String name,
        String namespace,
        Map<String, String> data,
        Map<String, String> labels,
        String resourceVersion
) {

    public SecretResource {
        data = data == null ? Map.of() : Map.copyOf(data);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public SecretResource withResourceVersion(String version) {
        return new SecretResource(name, namespace, data, labels, version);
    }

    @Override
    public String toString() {
        // Key names only, the encoded payload is as sensitive as the plaintext
        return "SecretResource[" + namespace + "/" + name
                + ", keys=" + new TreeSet<>(data.keySet())
                + ", labels=" + labels
                + ", resourceVersion=" + resourceVersion + "]";
    }
}
