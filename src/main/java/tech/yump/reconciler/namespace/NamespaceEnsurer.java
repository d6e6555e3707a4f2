package tech.yump.reconciler.namespace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.reconciler.audit.AuditEvent;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.AlreadyExistsException;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.cluster.ClusterException;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.retry.Retrier;
import tech.yump.reconciler.retry.Sleeper;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guarantees the target namespace exists and is Active before any secret is written.
 * Losing a create race to a parallel run counts as success.
 */
@Slf4j
@Component
public class NamespaceEnsurer {

    static final String ACTIVE_PHASE = "Active";

    private final ClusterApi clusterApi;
    private final ReconcilerProperties properties;
    private final Retrier readiness;
    private final AuditHelper auditHelper;

    public NamespaceEnsurer(ClusterApi clusterApi, ReconcilerProperties properties,
                            Sleeper sleeper, Clock clock, AuditHelper auditHelper) {
        this.clusterApi = clusterApi;
        this.properties = properties;
        this.readiness = new Retrier(properties.namespaceReady().toPolicy(), sleeper, clock);
        this.auditHelper = auditHelper;
    }

    public NamespaceOutcome ensure(String namespace) {
        log.info("Ensuring namespace '{}' exists...", namespace);

        NamespaceOutcome outcome;
        if (clusterApi.getNamespacePhase(namespace).isPresent()) {
            log.info("Namespace '{}' already exists", namespace);
            outcome = NamespaceOutcome.ALREADY_EXISTS;
        } else {
            outcome = create(namespace);
        }

        boolean active = readiness.await("namespace '" + namespace + "' to become " + ACTIVE_PHASE,
                () -> clusterApi.getNamespacePhase(namespace).map(ACTIVE_PHASE::equals).orElse(false));
        if (!active) {
            String phase = clusterApi.getNamespacePhase(namespace).orElse("absent");
            auditNamespace(namespace, "failure", "not active (phase " + phase + ")");
            throw new ClusterException("Namespace '" + namespace + "' is not " + ACTIVE_PHASE + " (phase: " + phase + ")");
        }

        auditNamespace(namespace, outcome == NamespaceOutcome.CREATED ? "created" : "already_exists", null);
        return outcome;
    }

    /**
     * Dry-run counterpart of {@link #ensure}: reports what ensure would do without creating anything.
     */
    public NamespaceOutcome plan(String namespace) {
        return clusterApi.getNamespacePhase(namespace).isPresent() ? NamespaceOutcome.ALREADY_EXISTS : NamespaceOutcome.CREATED;
    }

    private NamespaceOutcome create(String namespace) {
        log.info("Creating namespace '{}'...", namespace);
        try {
            clusterApi.createNamespace(namespace, labelsFor(namespace));
            log.info("Namespace '{}' created", namespace);
            return NamespaceOutcome.CREATED;
        } catch (AlreadyExistsException e) {
            // Another run created it between our read and our create
            log.info("Namespace '{}' was created concurrently; treating as existing", namespace);
            return NamespaceOutcome.ALREADY_EXISTS;
        }
    }

    Map<String, String> labelsFor(String namespace) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ManagedLabels.MANAGED_BY, properties.managedBy());
        String prefix = properties.namespaceEnvironmentPrefix();
        String environment = StringUtils.hasText(prefix) && namespace.startsWith(prefix) && namespace.length() > prefix.length()
                ? namespace.substring(prefix.length())
                : namespace;
        labels.put(ManagedLabels.ENVIRONMENT, environment);
        return labels;
    }

    private void auditNamespace(String namespace, String outcome, String error) {
        auditHelper.logEvent("namespace_operation", "ensure", outcome,
                AuditEvent.TargetInfo.builder().kind("Namespace").name(namespace).build(),
                error, null);
    }
}
