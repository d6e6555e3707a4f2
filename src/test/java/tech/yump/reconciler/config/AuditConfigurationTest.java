package tech.yump.reconciler.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.reconciler.audit.AuditBackend;
import tech.yump.reconciler.audit.FileAuditBackend;
import tech.yump.reconciler.audit.LogAuditBackend;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Audit Configuration")
class AuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(AuditConfiguration.class);

    @Test
    @DisplayName("Should default to the SLF4J backend")
    void defaultBackend() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AuditBackend.class);
            assertThat(context.getBean(AuditBackend.class)).isInstanceOf(LogAuditBackend.class);
        });
    }

    @Test
    @DisplayName("Should select the file backend when configured")
    void fileBackend() {
        contextRunner.withPropertyValues("reconciler.audit.backend=file").run(context -> {
            assertThat(context).hasSingleBean(AuditBackend.class);
            assertThat(context.getBean(AuditBackend.class)).isInstanceOf(FileAuditBackend.class);
        });
    }
}
