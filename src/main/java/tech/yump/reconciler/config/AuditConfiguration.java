package tech.yump.reconciler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import tech.yump.reconciler.audit.AuditBackend;
import tech.yump.reconciler.audit.FileAuditBackend;
import tech.yump.reconciler.audit.LogAuditBackend;

/**
 * Selects the audit backend from {@code reconciler.audit.backend}: {@code slf4j} (default) or {@code file}.
 * The rolling audit file appender is declared in logback-spring.xml under the {@code audit-file} profile.
 */
@Configuration
@Slf4j
public class AuditConfiguration {

    private static final String BACKEND_PROPERTY = "reconciler.audit.backend";
    static final String AUDIT_FILE_PROFILE = "audit-file";

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend(ObjectMapper objectMapper) {
        log.debug("Audit events go to the diagnostic log");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "file")
    public AuditBackend fileAuditBackend(ObjectMapper objectMapper, Environment environment) {
        if (!environment.acceptsProfiles(Profiles.of(AUDIT_FILE_PROFILE))) {
            log.warn("File audit backend selected without the '{}' profile; audit lines fall through to the console",
                    AUDIT_FILE_PROFILE);
        }
        log.debug("Audit events go to logger '{}' (file set by 'reconciler.audit.file.path')",
                FileAuditBackend.AUDIT_LOGGER_NAME);
        return new FileAuditBackend(objectMapper);
    }
}
