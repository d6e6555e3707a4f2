package tech.yump.reconciler.model;

/**
 * A value resolved for one key during a single run. Held in memory only.
 */
public record ResolvedValue(KeyRef ref, String value, SourceTier sourceTier) {

    public String keyName() {
        return ref.keyName();
    }

    @Override
    public String toString() {
        // Never render the value
        return "ResolvedValue[ref=" + ref + ", value=******, sourceTier=" + sourceTier + "]";
    }
}
