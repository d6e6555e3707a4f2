package tech.yump.reconciler.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events to the diagnostic log (stderr), one JSON document per event.
 * Failures are logged at WARN so they stand out from the INFO stream of the run.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    static final String PREFIX = "AUDIT ";

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Ignoring null audit event.");
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} audit event for action '{}'.", event.type(), event.action(), e);
            // Identity fields only; the event holds nothing sensitive but the data map is skipped
            log.info("{}type={} action={} outcome={} target={}", PREFIX, event.type(), event.action(), event.outcome(), event.target());
            return;
        }

        if ("failure".equals(event.outcome()) || "aborted".equals(event.outcome())) {
            log.warn("{}{}", PREFIX, json);
        } else {
            log.info("{}{}", PREFIX, json);
        }
    }
}
