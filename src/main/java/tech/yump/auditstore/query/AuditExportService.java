package tech.yump.auditstore.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.auditstore.audit.AuditEvent;
import tech.yump.auditstore.audit.AuditLogHandle;
import tech.yump.auditstore.audit.AuditTimestamps;
import tech.yump.auditstore.config.AuditStoreProperties;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports the complete filtered set of an audit log (no pagination) as CSV or JSON.
 */
@Service
@Slf4j
public class AuditExportService {

    private static final CsvSchema CSV_SCHEMA = CsvSchema.builder()
            .addColumn("event_id")
            .addColumn("timestamp")
            .addColumn("user_id")
            .addColumn("action_type")
            .addColumn("outcome")
            .addColumn("ip_address")
            .addColumn("user_agent")
            .addColumn("metadata")
            .build()
            .withHeader();

    private final AuditQueryService queryService;
    private final ObjectMapper objectMapper;
    // Not a bean: an ObjectMapper subtype in the context replaces Boot's auto-configured mapper
    private final CsvMapper csvMapper = new CsvMapper();
    private final Clock clock;
    private final int maxEvents;

    public AuditExportService(AuditQueryService queryService, ObjectMapper objectMapper, Clock clock,
                              AuditStoreProperties properties) {
        this.queryService = queryService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxEvents = properties.export().maxEvents();
    }

    /**
     * Plain-dictionary variant of {@link #exportAuditLogs(AuditLogHandle, ExportFormat, AuditQueryFilter)}.
     * An unsupported format yields the error document.
     */
    public ExportResult exportAuditLogs(AuditLogHandle handle, String format, @Nullable Map<String, ?> filters) {
        Instant exportTime = clock.instant();
        try {
            return export(handle, ExportFormat.fromValue(format), AuditQueryFilter.fromMap(filters), exportTime);
        } catch (RuntimeException e) {
            return failure(e, exportTime);
        }
    }

    /**
     * @return the export, or a JSON error document named {@code error_<stamp>.json} on failure
     */
    public ExportResult exportAuditLogs(AuditLogHandle handle, ExportFormat format, AuditQueryFilter filter) {
        Instant exportTime = clock.instant();
        try {
            return export(handle, format, filter, exportTime);
        } catch (RuntimeException e) {
            return failure(e, exportTime);
        }
    }

    private ExportResult export(AuditLogHandle handle, ExportFormat format, AuditQueryFilter filter, Instant exportTime) {
        List<AuditEvent> events = queryService.findMatching(handle, filter);
        if (events.size() > maxEvents) {
            throw new IllegalStateException("Export of " + events.size() + " events exceeds the limit of " + maxEvents);
        }

        String content = switch (format) {
            case CSV -> toCsv(events);
            case JSON -> toJson(events, exportTime);
        };
        String filename = "audit_log_" + AuditTimestamps.filenameStamp(exportTime) + "." + format.extension();
        log.info("Exported {} audit event(s) from scope '{}' as {}", events.size(), handle.scope(), filename);
        return new ExportResult(content, format.contentType(), filename);
    }

    private String toCsv(List<AuditEvent> events) {
        if (events.isEmpty()) {
            return "";
        }
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(CSV_SCHEMA).writeValues(out)) {
            for (AuditEvent event : events) {
                Map<String, Object> row = event.toMap();
                row.put("metadata", objectMapper.writeValueAsString(event.metadata()));
                writer.write(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export", e);
        }
        return out.toString();
    }

    private String toJson(List<AuditEvent> events, Instant exportTime) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("export_time", AuditTimestamps.format(exportTime));
        envelope.put("event_count", events.size());
        envelope.put("events", events.stream().map(AuditEvent::toMap).toList());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON export", e);
        }
    }

    private ExportResult failure(RuntimeException e, Instant exportTime) {
        log.error("Error exporting audit logs: {}", e.getMessage(), e);
        ObjectNode error = objectMapper.createObjectNode().put("error", String.valueOf(e.getMessage()));
        return new ExportResult(error.toPrettyString(), ExportFormat.JSON.contentType(),
                "error_" + AuditTimestamps.filenameStamp(exportTime) + ".json");
    }
}
