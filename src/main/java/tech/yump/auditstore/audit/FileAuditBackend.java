package tech.yump.auditstore.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An AuditBackend implementation that writes audit events as JSON lines
 * to a dedicated audit log file configured via Logback.
 */
@RequiredArgsConstructor
@Slf4j
public class FileAuditBackend implements AuditBackend {

    // Routed by logback-spring.xml (profile "audit-file") to ${auditstore.audit.file.path}
    public static final String AUDIT_LOGGER_NAME = "tech.yump.auditstore.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(String scope, AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(LogAuditBackend.withScope(scope, event)));
        } catch (JsonProcessingException e) {
            // Keep the audit file pure JSON; report the failure in the application log instead
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Event: {}", event, e);
        }
    }
}
