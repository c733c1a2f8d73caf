package tech.yump.auditstore.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import tech.yump.auditstore.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuditBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AuditEvent event = AuditEvent.create(new MutableClock(Instant.parse("2026-10-19T10:00:00Z")),
            "alice", "aal2_access_denied", "failure", "10.0.0.9", "curl/8", Map.of("reason", "stale"));

    private ListAppender<ILoggingEvent> fileAppender;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger fileAuditLogger;
    private Logger logBackendLogger;

    @BeforeEach
    void setUp() {
        fileAuditLogger = (Logger) LoggerFactory.getLogger(FileAuditBackend.AUDIT_LOGGER_NAME);
        fileAppender = new ListAppender<>();
        fileAppender.start();
        fileAuditLogger.addAppender(fileAppender);
        fileAuditLogger.setAdditive(false);

        logBackendLogger = (Logger) LoggerFactory.getLogger(LogAuditBackend.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logBackendLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        fileAuditLogger.detachAppender(fileAppender);
        fileAppender.stop();
        logBackendLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("FileAuditBackend writes one JSON line to the dedicated audit logger")
    void fileBackend_logsJsonLine() {
        new FileAuditBackend(objectMapper).logEvent("site", event);

        List<ILoggingEvent> logs = fileAppender.list;
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(logs.get(0).getLoggerName()).isEqualTo(FileAuditBackend.AUDIT_LOGGER_NAME);
        assertThat(logs.get(0).getFormattedMessage())
                .startsWith("{\"scope\":\"site\",\"event_id\":\"" + event.eventId() + "\"")
                .contains("\"action_type\":\"aal2_access_denied\"")
                .contains("\"metadata\":{\"reason\":\"stale\"}");
    }

    @Test
    @DisplayName("FileAuditBackend keeps the audit file clean when serialization fails")
    void fileBackend_serializationFailure_writesNothing() throws JsonProcessingException {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("Test exception") {});

        new FileAuditBackend(failing).logEvent("site", event);

        assertThat(fileAppender.list).isEmpty();
    }

    @Test
    @DisplayName("LogAuditBackend logs the event with the AUDIT_EVENT prefix")
    void logBackend_logsPrefixedJson() {
        new LogAuditBackend(objectMapper).logEvent("site", event);

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement()
                .asString()
                .startsWith("AUDIT_EVENT: {\"scope\":\"site\"")
                .contains(event.eventId());
    }

    @Test
    @DisplayName("LogAuditBackend falls back to the raw event when serialization fails")
    void logBackend_serializationFailure_logsFallback() throws JsonProcessingException {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("Test exception") {});

        new LogAuditBackend(failing).logEvent("site", event);

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.startsWith("AUDIT_EVENT_FALLBACK:") && message.contains(event.eventId()));
    }

    @Test
    @DisplayName("Null events are ignored")
    void nullEvent_isIgnored() {
        new FileAuditBackend(objectMapper).logEvent("site", null);
        new LogAuditBackend(objectMapper).logEvent("site", null);

        assertThat(fileAppender.list).isEmpty();
        assertThat(logAppender.list).extracting(ILoggingEvent::getLevel).containsOnly(Level.WARN);
    }
}
