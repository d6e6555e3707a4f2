package tech.yump.reconciler.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.yump.reconciler.config.ReconcilerProperties;
import tech.yump.reconciler.core.ExitStatus;
import tech.yump.reconciler.service.RunReport;
import tech.yump.reconciler.service.SecretProvisioningService;

/**
 * Entry point of the {@code reconcile} command. Runs once after startup; the exit status is picked up by
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
@ConditionalOnProperty(name = "reconciler.command.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconcileCommand implements ApplicationRunner, ExitCodeGenerator {

    private final SecretProvisioningService provisioningService;
    private final ReconcilerProperties properties;
    private final RunReporter reporter;
    private final ReconcileExceptionHandler exceptionHandler;

    private volatile ExitStatus exitStatus = ExitStatus.SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        try {
            CommandOptions options = CommandOptions.parse(args);
            if (options.help()) {
                reporter.printUsage(properties);
                exitStatus = ExitStatus.SUCCESS;
                return;
            }
            RunReport report = provisioningService.run(options.toRequest(properties.defaultNamespace()));
            reporter.print(report);
            exitStatus = report.exitStatus();
        } catch (RuntimeException e) {
            exitStatus = exceptionHandler.handle(e);
        }
        log.debug("Command finished with exit status {}", exitStatus.code());
    }

    public ExitStatus exitStatus() {
        return exitStatus;
    }

    @Override
    public int getExitCode() {
        return exitStatus.code();
    }
}
