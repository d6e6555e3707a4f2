package tech.yump.reconciler.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.config.ReconcilerProperties;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    private final AuditBackend auditBackend;
    private final ReconcilerProperties properties;

    /**
     * Records the outcome of an operation on a single secret.
     *
     * @param action       The action performed (e.g. "reconcile", "verify", "submit_reference").
     * @param outcome      The result (e.g. "created", "pass", "failure").
     * @param namespace    Namespace of the secret.
     * @param secretName   Name of the secret.
     * @param keys         Key names involved; never values.
     * @param errorMessage Optional error message (for failures).
     */
    public void logSecretEvent(
            String action,
            String outcome,
            String namespace,
            String secretName,
            @Nullable List<String> keys,
            @Nullable String errorMessage) {

        AuditEvent.TargetInfo target = AuditEvent.TargetInfo.builder()
                .namespace(namespace)
                .kind("Secret")
                .name(secretName)
                .keys(keys)
                .build();
        logEvent("secret_operation", action, outcome, target, errorMessage, null);
    }

    /**
     * Logs an audit event. Failures of the backend are logged and swallowed so that
     * auditing can never abort a run.
     *
     * @param type         The event family (e.g. "namespace_operation", "run").
     * @param action       The specific action performed.
     * @param outcome      The result.
     * @param target       Optional resource the event is about.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logEvent(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.TargetInfo target,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .principal(properties.audit().principal())
                    .target(target)
                    .errorMessage(errorMessage)
                    .data(data != null && !data.isEmpty() ? data : null) // Ensure null if empty
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }
}
