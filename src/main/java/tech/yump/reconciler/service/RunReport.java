package tech.yump.reconciler.service;

import tech.yump.reconciler.core.ExitStatus;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.VerificationReport;
import tech.yump.reconciler.model.VerificationStatus;
import tech.yump.reconciler.namespace.NamespaceOutcome;

import java.util.List;
import java.util.stream.Stream;

/**
 * Everything a completed run produced. Runs that abort never produce a report; they raise instead.
 *
 * @param namespaceOutcome {@code null} for verify-only runs
 * @param undeclared       managed secrets found in the namespace that are no longer declared
 */
public record RunReport(
        RunRequest request,
        NamespaceOutcome namespaceOutcome,
        List<ReconciliationResult> results,
        List<VerificationReport> reports,
        List<String> undeclared
) {

    public RunReport {
        results = List.copyOf(results);
        reports = List.copyOf(reports);
        undeclared = List.copyOf(undeclared);
    }

    public long count(ReconcileAction action) {
        return results.stream().filter(r -> r.action() == action).count();
    }

    public long count(VerificationStatus status) {
        return reports.stream().filter(r -> r.status() == status).count();
    }

    /**
     * Number of distinct secrets that failed reconciliation, verification or both.
     */
    public long failedSecrets() {
        return Stream.concat(
                        results.stream().filter(ReconciliationResult::isFailed).map(ReconciliationResult::secretName),
                        reports.stream().filter(r -> r.status() == VerificationStatus.FAIL).map(VerificationReport::secretName))
                .distinct()
                .count();
    }

    /**
     * Worst outcome over all results and reports. {@code Pending} only counts against the run in strict mode.
     */
    public ExitStatus exitStatus() {
        ExitStatus status = ExitStatus.SUCCESS;
        if (failedSecrets() > 0) {
            status = status.worst(ExitStatus.PARTIAL_FAILURE);
        }
        if (request.strict() && count(VerificationStatus.PENDING) > 0) {
            status = status.worst(ExitStatus.PARTIAL_FAILURE);
        }
        return status;
    }
}
