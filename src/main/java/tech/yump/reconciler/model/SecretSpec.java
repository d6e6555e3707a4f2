package tech.yump.reconciler.model;

import java.util.List;
import java.util.Map;

/**
 * Static declaration of a secret resource: where it lives, which keys it must carry,
 * and which labels mark it as managed by this tool.
 */
public record SecretSpec(
        String name,
        String namespace,
        List<KeySpec> keys,
        Map<String, String> managedLabels
) {

    public SecretSpec {
        keys = List.copyOf(keys);
        managedLabels = Map.copyOf(managedLabels);
    }

    public List<String> keyNames() {
        return keys.stream().map(KeySpec::keyName).sorted().toList();
    }
}
