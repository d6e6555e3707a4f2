package tech.yump.reconciler.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single audit log entry for a reconcile run.
 * Carries resource identities and key names only; secret values never enter an event.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,       // When the event occurred
        String type,             // Event family (e.g. "secret_operation", "namespace_operation", "run")
        String action,           // Specific action (e.g. "reconcile", "verify", "ensure")
        String outcome,          // Result (e.g. "created", "unchanged", "failure")
        String principal,        // Identity the tool runs as, for correlation

        TargetInfo target,

        String errorMessage,     // Set on failures; same redaction rules as user-facing messages

        Map<String, Object> data
) {

    /**
     * The resource an event is about.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TargetInfo(
            String namespace,
            String kind,          // "Secret", "Namespace", "ExternalSecret", ...
            String name,
            List<String> keys     // Data key names, never values
    ) {}
}
