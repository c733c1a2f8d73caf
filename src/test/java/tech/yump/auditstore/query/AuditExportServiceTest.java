package tech.yump.auditstore.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.auditstore.MutableClock;
import tech.yump.auditstore.audit.AuditContainerRegistry;
import tech.yump.auditstore.audit.AuditEvent;
import tech.yump.auditstore.audit.AuditLogHandle;
import tech.yump.auditstore.config.AuditStoreProperties;
import tech.yump.auditstore.storage.NoopAuditJournal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditExportServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T14:05:09.250Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(NOW);

    private AuditLogHandle handle;
    private AuditExportService exportService;

    @BeforeEach
    void setUp() {
        AuditStoreProperties properties = new AuditStoreProperties(null, null, null,
                new AuditStoreProperties.ExportProperties(3), null, null);
        handle = new AuditContainerRegistry(new NoopAuditJournal(), clock, properties).getOrCreate("site");
        exportService = new AuditExportService(new AuditQueryService(), objectMapper, clock, properties);
    }

    private AuditEvent add(String user, String action, String outcome, Map<String, ?> metadata) {
        AuditEvent event = AuditEvent.create(clock, user, action, outcome, "10.0.0.1", "Agent, with comma", metadata);
        handle.addEvent(event);
        clock.advance(Duration.ofSeconds(1));
        return event;
    }

    @Test
    @DisplayName("CSV export has the fixed header and one row per event, most recent first")
    void exportCsv_writesHeaderAndRows() throws Exception {
        AuditEvent first = add("alice", "registration_success", "success", Map.of("credential_id", "c-1"));
        AuditEvent second = add("bob", "authentication_failure", "failure", null);

        ExportResult result = exportService.exportAuditLogs(handle, "csv", null);

        assertThat(result.contentType()).isEqualTo("text/csv");
        assertThat(result.filename()).isEqualTo("audit_log_20261019_140511.csv");
        assertThat(result.content())
                .startsWith("event_id,timestamp,user_id,action_type,outcome,ip_address,user_agent,metadata\n");

        MappingIterator<Map<String, String>> iterator = new CsvMapper()
                .readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(result.content());
        List<Map<String, String>> rows = iterator.readAll();

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0))
                .containsEntry("event_id", second.eventId())
                .containsEntry("outcome", "failure")
                .containsEntry("metadata", "{}");
        assertThat(rows.get(1))
                .containsEntry("event_id", first.eventId())
                .containsEntry("timestamp", "2026-10-19T14:05:09.250000+00:00")
                .containsEntry("user_id", "alice")
                .containsEntry("action_type", "registration_success")
                .containsEntry("ip_address", "10.0.0.1")
                .containsEntry("user_agent", "Agent, with comma")
                .containsEntry("metadata", "{\"credential_id\":\"c-1\"}");
    }

    @Test
    @DisplayName("An empty result exports as empty CSV content")
    void exportCsv_empty_returnsEmptyContent() {
        ExportResult result = exportService.exportAuditLogs(handle, "CSV", Map.of("user_id", "nobody"));

        assertThat(result.content()).isEmpty();
        assertThat(result.contentType()).isEqualTo("text/csv");
        assertThat(result.filename()).endsWith(".csv");
    }

    @Test
    @DisplayName("JSON export wraps the filtered events in an envelope")
    void exportJson_writesEnvelope() throws Exception {
        add("alice", "aal2_policy_set", "success", Map.of("pattern", "/admin/*"));
        AuditEvent failure = add("alice", "aal2_access_denied", "failure", Map.of("reason", "expired"));
        add("bob", "aal2_access_denied", "failure", null);

        ExportResult result = exportService.exportAuditLogs(handle, ExportFormat.JSON,
                AuditQueryFilter.fromMap(Map.of("user_id", "alice", "outcome", "failure")));

        assertThat(result.contentType()).isEqualTo("application/json");
        assertThat(result.filename()).isEqualTo("audit_log_20261019_140512.json");
        JsonNode json = objectMapper.readTree(result.content());
        assertThat(json.get("export_time").asText()).isEqualTo("2026-10-19T14:05:12.250000+00:00");
        assertThat(json.get("event_count").asInt()).isEqualTo(1);
        assertThat(json.get("events")).hasSize(1);
        assertThat(json.get("events").get(0).get("event_id").asText()).isEqualTo(failure.eventId());
        assertThat(json.get("events").get(0).get("metadata").get("reason").asText()).isEqualTo("expired");
    }

    @Test
    @DisplayName("An unsupported format yields the JSON error document")
    void export_unsupportedFormat_returnsError() throws Exception {
        ExportResult result = exportService.exportAuditLogs(handle, "xml", null);

        assertThat(result.contentType()).isEqualTo("application/json");
        assertThat(result.filename()).isEqualTo("error_20261019_140509.json");
        assertThat(objectMapper.readTree(result.content()).get("error").asText())
                .isEqualTo("Unsupported export format: xml");
    }

    @Test
    @DisplayName("Exports larger than the configured maximum are refused")
    void export_tooManyEvents_returnsError() throws Exception {
        for (int i = 0; i < 4; i++) {
            add("user" + i, "authentication_start", "success", null);
        }

        ExportResult result = exportService.exportAuditLogs(handle, "json", null);

        assertThat(result.filename()).startsWith("error_");
        assertThat(objectMapper.readTree(result.content()).get("error").asText())
                .contains("exceeds the limit of 3");
    }
}
