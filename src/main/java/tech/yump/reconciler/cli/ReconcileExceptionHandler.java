package tech.yump.reconciler.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.audit.AuditHelper;
import tech.yump.reconciler.cluster.ClusterException;
import tech.yump.reconciler.cluster.ConnectivityException;
import tech.yump.reconciler.cluster.PermissionException;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ConfigurationException;
import tech.yump.reconciler.core.ExitStatus;
import tech.yump.reconciler.env.MissingValue;
import tech.yump.reconciler.env.MissingValueException;
import tech.yump.reconciler.schema.KeyValidationOutcome;
import tech.yump.reconciler.schema.ValidationException;

import java.util.Map;

/**
 * Turns a failed run into an exit status, a log entry, an audit event and an error line.
 * Every message names secrets and keys; none contains a value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconcileExceptionHandler {

    private final RunReporter reporter;
    private final AuditHelper auditHelper;
    private final ReconcilerProperties properties;

    public ExitStatus handle(RuntimeException ex) {
        if (ex instanceof UsageException) {
            log.debug("Usage error: {}", ex.getMessage());
            reporter.printError(ex.getMessage());
            reporter.printUsage(properties);
            return ExitStatus.VALIDATION_FAILURE;
        }
        if (ex instanceof MissingValueException missing) {
            log.error("Run aborted before any change: {} missing value(s)", missing.getMissing().size());
            for (MissingValue value : missing.getMissing()) {
                reporter.printError("no value for secret '" + value.ref().secretName() + "' key '"
                        + value.ref().keyName() + "' (set " + value.sourceVar() + ")");
            }
            return abort("missing_values", ex, ExitStatus.VALIDATION_FAILURE);
        }
        if (ex instanceof ValidationException invalid) {
            log.error("Run aborted before any change: {} invalid value(s)", invalid.getFailures().size());
            for (KeyValidationOutcome failure : invalid.getFailures()) {
                reporter.printError("invalid value for secret '" + failure.ref().secretName() + "' key '"
                        + failure.ref().keyName() + "': " + String.join("; ", failure.violations()));
            }
            return abort("invalid_values", ex, ExitStatus.VALIDATION_FAILURE);
        }
        if (ex instanceof ConfigurationException) {
            log.error("Configuration error: {}", ex.getMessage());
            reporter.printError(ex.getMessage());
            return abort("configuration", ex, ExitStatus.VALIDATION_FAILURE);
        }
        if (ex instanceof ConnectivityException || ex instanceof PermissionException) {
            log.error("Cluster access failed: {}", ex.getMessage());
            reporter.printError(ex.getMessage());
            return abort(ex instanceof PermissionException ? "permission" : "connectivity", ex, ExitStatus.CLUSTER_FAILURE);
        }
        if (ex instanceof ClusterException) {
            log.error("Cluster operation failed: {}", ex.getMessage(), ex);
            reporter.printError(ex.getMessage());
            return abort("cluster", ex, ExitStatus.CLUSTER_FAILURE);
        }
        // Nothing about the run's progress can be claimed, so it counts as partial failure
        log.error("Unexpected error during run", ex);
        reporter.printError("unexpected " + ex.getClass().getSimpleName());
        return abort("unexpected", ex, ExitStatus.PARTIAL_FAILURE);
    }

    private ExitStatus abort(String cause, RuntimeException ex, ExitStatus status) {
        auditHelper.logEvent("run", "reconcile", "aborted", null, ex.getMessage(),
                Map.of("cause", cause, "exit_status", status.code()));
        return status;
    }
}
