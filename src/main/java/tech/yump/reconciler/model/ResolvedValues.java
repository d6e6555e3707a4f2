package tech.yump.reconciler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The immutable set of values resolved for a run, indexed by secret and key.
 */
public final class ResolvedValues {

    private static final ResolvedValues EMPTY = new ResolvedValues(Map.of());

    private final Map<KeyRef, ResolvedValue> values;

    public ResolvedValues(Map<KeyRef, ResolvedValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ResolvedValues empty() {
        return EMPTY;
    }

    public Optional<ResolvedValue> get(KeyRef ref) {
        return Optional.ofNullable(values.get(ref));
    }

    /**
     * Values of one secret keyed by data key name, in declaration order.
     */
    public Map<String, ResolvedValue> forSecret(SecretSpec spec) {
        Map<String, ResolvedValue> result = new LinkedHashMap<>();
        for (KeySpec key : spec.keys()) {
            ResolvedValue value = values.get(key.ref());
            if (value != null) {
                result.put(key.keyName(), value);
            }
        }
        return result;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "ResolvedValues" + values.keySet();
    }
}
