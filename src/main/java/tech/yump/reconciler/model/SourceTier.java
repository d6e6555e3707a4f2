package tech.yump.reconciler.model;

/**
 * Where a resolved value came from, highest priority first.
 */
public enum SourceTier {
    ENVIRONMENT,
    OVERRIDE_FILE,
    GENERATED
}
