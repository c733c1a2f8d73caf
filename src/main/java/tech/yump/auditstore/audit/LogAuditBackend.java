package tech.yump.auditstore.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An AuditBackend implementation that writes each event as a JSON string
 * to the application log at INFO level.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(String scope, AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            String jsonEvent = objectMapper.writeValueAsString(withScope(scope, event));
            log.info("AUDIT_EVENT: {}", jsonEvent);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditEvent to JSON. Logging raw event details.", e);
            log.info("AUDIT_EVENT_FALLBACK: scope={} {}", scope, event);
        }
    }

    static Map<String, Object> withScope(String scope, AuditEvent event) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("scope", scope);
        line.putAll(event.toMap());
        return line;
    }
}
