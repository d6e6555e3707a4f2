package tech.yump.reconciler.audit;

/**
 * Destination for the audit trail of a reconcile run.
 * Implementations must not throw for a well-formed event; {@link AuditHelper} guards the callers anyway.
 */
public interface AuditBackend {

    /**
     * Records one event. Events carry resource identities and key names, never values.
     *
     * @param event the event to record; implementations ignore {@code null}
     */
    void logEvent(AuditEvent event);

}
