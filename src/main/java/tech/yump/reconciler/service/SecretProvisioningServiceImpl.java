package tech.yump.reconciler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.reconciler.audit.AuditEvent;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.ClusterApi;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ExitStatus;
import tech.yump.reconciler.env.EnvironmentResolver;
import tech.yump.reconciler.external.ExternalBackendAdapter;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.ResolvedValues;
import tech.yump.reconciler.model.SecretSpec;
import tech.yump.reconciler.model.VerificationReport;
import tech.yump.reconciler.model.VerificationStatus;
import tech.yump.reconciler.namespace.NamespaceEnsurer;
import tech.yump.reconciler.namespace.NamespaceOutcome;
import tech.yump.reconciler.reconcile.SecretReconciler;
import tech.yump.reconciler.schema.SchemaRegistry;
import tech.yump.reconciler.verify.SecretVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class SecretProvisioningServiceImpl implements SecretProvisioningService {

    private final ReconcilerProperties properties;
    private final SchemaRegistry schemaRegistry;
    private final EnvironmentResolver environmentResolver;
    private final ClusterApi clusterApi;
    private final NamespaceEnsurer namespaceEnsurer;
    private final SecretReconciler secretReconciler;
    private final ExternalBackendAdapter externalBackendAdapter;
    private final SecretVerifier secretVerifier;
    private final AuditHelper auditHelper;

    @Override
    public RunReport run(RunRequest request) {
        String namespace = request.namespace();
        boolean external = properties.backend() == ReconcilerProperties.Backend.EXTERNAL;
        List<SecretSpec> specs = schemaRegistry.specsFor(namespace);
        log.info("Starting {} run for namespace '{}' ({} backend, {} secret(s))",
                request.verifyOnly() ? "verify-only" : request.dryRun() ? "dry-run" : "reconcile",
                namespace, properties.backend().name().toLowerCase(), specs.size());

        if (request.verifyOnly()) {
            clusterApi.checkConnectivity();
            return finish(request, null, List.of(), specs, external);
        }

        // Validation gate: every value must resolve and validate before the cluster is touched
        ResolvedValues values = external ? ResolvedValues.empty() : resolveAndValidate(specs);

        clusterApi.checkConnectivity();

        if (request.dryRun()) {
            NamespaceOutcome planned = namespaceEnsurer.plan(namespace);
            log.info("[dry-run] Namespace '{}' {}", namespace,
                    planned == NamespaceOutcome.CREATED ? "would be created" : "already exists");
            List<ReconciliationResult> results = external
                    ? externalBackendAdapter.plan(namespace, specs)
                    : secretReconciler.plan(specs, values);
            RunReport report = new RunReport(request, planned, results, List.of(), List.of());
            auditRun(report);
            return report;
        }

        NamespaceOutcome namespaceOutcome = namespaceEnsurer.ensure(namespace);
        List<ReconciliationResult> results = external
                ? externalBackendAdapter.submit(namespace, specs)
                : secretReconciler.reconcile(specs, values);
        return finish(request, namespaceOutcome, results, specs, external);
    }

    private ResolvedValues resolveAndValidate(List<SecretSpec> specs) {
        ResolvedValues values = environmentResolver.resolve(SchemaRegistry.requiredKeys(specs)).valuesOrThrow();
        schemaRegistry.validate(specs, values).throwIfFailed();
        return values;
    }

    private RunReport finish(RunRequest request, NamespaceOutcome namespaceOutcome,
                             List<ReconciliationResult> results, List<SecretSpec> specs, boolean external) {
        List<VerificationReport> reports = secretVerifier.verify(specs, external);
        List<String> undeclared = secretVerifier.undeclaredManagedSecrets(request.namespace(), specs);
        RunReport report = new RunReport(request, namespaceOutcome, results, reports, undeclared);
        log.info("Run finished with exit status {} ({})", report.exitStatus().code(), report.exitStatus());
        auditRun(report);
        return report;
    }

    private void auditRun(RunReport report) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("dry_run", report.request().dryRun());
        data.put("verify_only", report.request().verifyOnly());
        for (ReconcileAction action : ReconcileAction.values()) {
            data.put(action.name().toLowerCase(), report.count(action));
        }
        data.put("pending", report.count(VerificationStatus.PENDING));
        data.put("exit_status", report.exitStatus().code());
        auditHelper.logEvent("run", "reconcile", report.exitStatus() == ExitStatus.SUCCESS ? "success" : "failure",
                AuditEvent.TargetInfo.builder().kind("Namespace").name(report.request().namespace()).build(),
                null, data);
    }
}
