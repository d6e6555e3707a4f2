package tech.yump.reconciler.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An AuditBackend implementation that writes one JSON line per event
 * to the dedicated audit file configured in logback-spring.xml.
 */
@RequiredArgsConstructor
@Slf4j // internal errors go to the main log, never into the audit file
public class FileAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.reconciler.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // A partial line would break the JSON-lines format of the audit file
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Type={}, Action={}",
                    event.type(), event.action(), e);
        }
    }
}
