package tech.yump.reconciler.cli;

import org.springframework.stereotype.Component;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.model.ReconcileAction;
import tech.yump.reconciler.model.ReconciliationResult;
import tech.yump.reconciler.model.VerificationReport;
import tech.yump.reconciler.model.VerificationStatus;
import tech.yump.reconciler.namespace.NamespaceOutcome;
import tech.yump.reconciler.service.RunReport;

import java.io.PrintStream;

/**
 * Writes the user-facing report: one line per secret and a summary. Only names, actions and key names
 * are printed.
 */
@Component
public class RunReporter {

    private final PrintStream out;

    public RunReporter(PrintStream reportStream) {
        this.out = reportStream;
    }

    public void print(RunReport report) {
        boolean dryRun = report.request().dryRun();
        if (report.namespaceOutcome() != null) {
            out.println("namespace " + report.request().namespace() + ": " + describe(report.namespaceOutcome(), dryRun));
        }
        for (ReconciliationResult result : report.results()) {
            String line = result.secretName() + ": " + (dryRun ? planned(result.action()) : result.action().label());
            if (result.error() != null) {
                line += " (" + result.error() + ")";
            }
            out.println(line);
        }
        for (VerificationReport verification : report.reports()) {
            out.println(verification.secretName() + ": " + verification.status().label() + " keys=" + verification.presentKeys());
            verification.findings().forEach(finding -> out.println("  - " + finding));
        }
        for (String name : report.undeclared()) {
            out.println(name + ": managed but no longer declared");
        }
        out.println(summary(report));
    }

    public void printError(String message) {
        out.println("Error: " + message);
    }

    public void printUsage(ReconcilerProperties properties) {
        out.println("Usage: " + CommandOptions.COMMAND + " [<namespace>] [--verify-only] [--dry-run] [--strict] [--help]");
        out.println();
        out.println("  <namespace>      target namespace (default: " + properties.defaultNamespace() + ")");
        out.println("  -v, --verify-only  only verify existing secrets");
        out.println("  -d, --dry-run      resolve, validate and show the plan without changing anything");
        out.println("  -s, --strict       treat pending secrets as failures");
        out.println("  -h, --help         show this help");
        out.println();
        out.println("Backend: " + properties.backend().name().toLowerCase());
        out.println("Declared secrets (value sources are environment variables or the override file):");
        for (ReconcilerProperties.SecretDefinition secret : properties.secrets()) {
            out.println("  " + secret.name());
            for (ReconcilerProperties.KeyDefinition key : secret.keys()) {
                out.println("    " + key.name() + " <- " + key.sourceVar() + (key.generatable() ? " (generated if unset)" : ""));
            }
        }
        out.println("Override files, first existing wins: " + String.join(", ", properties.overrideFiles()));
        out.println();
        out.println("Exit codes: 0 success, 1 validation or missing value, 2 connectivity or permission, 3 partial failure");
    }

    static String summary(RunReport report) {
        String summary = "Summary: created=" + report.count(ReconcileAction.CREATED)
                + " updated=" + report.count(ReconcileAction.UPDATED)
                + " unchanged=" + report.count(ReconcileAction.UNCHANGED)
                + " failed=" + report.failedSecrets()
                + " pending=" + report.count(VerificationStatus.PENDING);
        long submitted = report.count(ReconcileAction.SUBMITTED);
        return submitted > 0 ? summary + " submitted=" + submitted : summary;
    }

    private static String planned(ReconcileAction action) {
        return switch (action) {
            case CREATED -> "would create";
            case UPDATED -> "would update";
            case SUBMITTED -> "would submit";
            default -> action.label();
        };
    }

    private static String describe(NamespaceOutcome outcome, boolean dryRun) {
        if (outcome == NamespaceOutcome.CREATED) {
            return dryRun ? "would create" : "Created";
        }
        return "Exists";
    }
}
