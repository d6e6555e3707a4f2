package tech.yump.reconciler.verify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.cluster.ReferenceState;
import tech.yump.reconciler.cluster.SecretResource;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ManagedLabels;
import tech.yump.reconciler.external.ExternalBackendAdapter;
import tech.yump.reconciler.model.KeySpec;
import tech.yump.reconciler.model.SecretSpec;
import tech.yump.reconciler.model.VerificationReport;
import tech.yump.reconciler.model.VerificationStatus;
import tech.yump.reconciler.reconcile.SecretPayloads;
import tech.yump.reconciler.schema.KeyValidationOutcome;
import tech.yump.reconciler.schema.SchemaRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Re-reads the cluster and checks each declared secret independently of how it got there:
 * it exists, carries exactly the declared keys, and every value satisfies its key's rules.
 * Values are decoded only to be checked; reports and logs name keys, never values.
 */
@Slf4j
@Component
public class SecretVerifier {

    private final ClusterApi clusterApi;
    private final SchemaRegistry schemaRegistry;
    private final ReconcilerProperties properties;
    private final Clock clock;
    private final AuditHelper auditHelper;

    public SecretVerifier(ClusterApi clusterApi, SchemaRegistry schemaRegistry, ReconcilerProperties properties,
                          Clock clock, AuditHelper auditHelper) {
        this.clusterApi = clusterApi;
        this.schemaRegistry = schemaRegistry;
        this.properties = properties;
        this.clock = clock;
        this.auditHelper = auditHelper;
    }

    public List<VerificationReport> verify(List<SecretSpec> specs) {
        return verify(specs, properties.backend() == ReconcilerProperties.Backend.EXTERNAL);
    }

    /**
     * @param externalMode whether secrets are materialized by the external synchronizer, in which case
     *                     an absent secret with a recent reference is {@link VerificationStatus#PENDING}
     */
    public List<VerificationReport> verify(List<SecretSpec> specs, boolean externalMode) {
        log.info("Verifying {} secret(s)...", specs.size());
        List<VerificationReport> reports = new ArrayList<>();
        for (SecretSpec spec : specs) {
            VerificationReport report = clusterApi.getSecret(spec.namespace(), spec.name())
                    .map(secret -> inspect(spec, secret))
                    .orElseGet(() -> absent(spec, externalMode));
            log.info("Secret '{}': {} (expected keys {}, present keys {})",
                    spec.name(), report.status().label(), report.expectedKeys(), report.presentKeys());
            auditHelper.logSecretEvent("verify", report.status().name().toLowerCase(), spec.namespace(), spec.name(),
                    report.presentKeys(), report.findings().isEmpty() ? null : String.join("; ", report.findings()));
            reports.add(report);
        }
        return reports;
    }

    /**
     * Names of secrets in the namespace that carry this tool's managed-by label but are no longer declared.
     * They are reported for cleanup, never deleted.
     */
    public List<String> undeclaredManagedSecrets(String namespace, List<SecretSpec> specs) {
        Set<String> declared = new TreeSet<>();
        specs.forEach(spec -> declared.add(spec.name()));
        List<String> undeclared = clusterApi.listSecrets(namespace, ManagedLabels.selector(properties.managedBy())).stream()
                .map(SecretResource::name)
                .filter(name -> !declared.contains(name))
                .sorted()
                .toList();
        if (!undeclared.isEmpty()) {
            log.warn("Managed secrets no longer declared in namespace '{}': {}", namespace, undeclared);
        }
        return undeclared;
    }

    private VerificationReport inspect(SecretSpec spec, SecretResource secret) {
        List<String> expected = spec.keyNames();
        List<String> present = new ArrayList<>(new TreeSet<>(secret.data().keySet()));
        List<String> findings = new ArrayList<>();
        boolean keysValid = true;

        for (String key : expected) {
            if (!present.contains(key)) {
                findings.add("missing key '" + key + "'");
            }
        }
        for (String key : present) {
            if (!expected.contains(key)) {
                findings.add("unexpected key '" + key + "'");
            }
        }

        for (KeySpec key : spec.keys()) {
            String encoded = secret.data().get(key.keyName());
            if (encoded == null) {
                continue;
            }
            String decoded;
            try {
                decoded = SecretPayloads.decode(encoded);
            } catch (IllegalArgumentException e) {
                findings.add("key '" + key.keyName() + "' is not valid base64");
                keysValid = false;
                continue;
            }
            KeyValidationOutcome outcome = schemaRegistry.check(key, decoded);
            if (!outcome.valid()) {
                keysValid = false;
                outcome.violations().forEach(v -> findings.add("key '" + key.keyName() + "' " + v));
            }
        }

        boolean structural = findings.isEmpty();
        for (Map.Entry<String, String> label : spec.managedLabels().entrySet()) {
            if (!label.getValue().equals(secret.labels().get(label.getKey()))) {
                findings.add("warning: label '" + label.getKey() + "' missing or different");
            }
        }

        VerificationStatus status = structural && keysValid ? VerificationStatus.PASS : VerificationStatus.FAIL;
        return new VerificationReport(spec.name(), expected, present, keysValid, status, findings);
    }

    private VerificationReport absent(SecretSpec spec, boolean externalMode) {
        if (!externalMode) {
            return notPresent(spec, VerificationStatus.FAIL, "secret not found");
        }
        Optional<ReferenceState> reference = clusterApi.getReferenceState(properties.external().apiVersion(),
                ExternalBackendAdapter.EXTERNAL_SECRET_KIND, spec.namespace(), spec.name());
        if (reference.isEmpty()) {
            return notPresent(spec, VerificationStatus.FAIL, "secret not found and no "
                    + ExternalBackendAdapter.EXTERNAL_SECRET_KIND + " references it");
        }

        ReferenceState state = reference.get();
        String detail = state.reason() != null ? " (" + state.reason() + ")" : "";
        Duration grace = properties.external().pendingGrace();
        if (withinGrace(state, grace)) {
            return notPresent(spec, VerificationStatus.PENDING, "not yet materialized by the external store" + detail);
        }
        return notPresent(spec, VerificationStatus.FAIL,
                "not materialized within " + grace.toMinutes() + " min" + (state.ready() ? "" : detail));
    }

    private boolean withinGrace(ReferenceState state, Duration grace) {
        // Without a creation timestamp the reference is treated as freshly submitted
        return state.createdAt() == null || state.createdAt().plus(grace).isAfter(clock.instant());
    }

    private static VerificationReport notPresent(SecretSpec spec, VerificationStatus status, String finding) {
        return new VerificationReport(spec.name(), spec.keyNames(), List.of(), false, status, List.of(finding));
    }
}
