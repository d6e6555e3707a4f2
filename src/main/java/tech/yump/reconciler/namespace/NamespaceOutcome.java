package tech.yump.reconciler.namespace;

public enum NamespaceOutcome {
    CREATED,
    ALREADY_EXISTS
}
