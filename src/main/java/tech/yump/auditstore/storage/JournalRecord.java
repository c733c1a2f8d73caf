package tech.yump.auditstore.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One committed mutation of a scope, as written to its journal.
 *
 * <pre>
 * {"type":"created","recordedAt":"...","created":"...","retentionDays":90}
 * {"type":"event_added","recordedAt":"...","event":{"event_id":"...", ...}}
 * {"type":"events_cleaned","recordedAt":"...","cutoff":"..."}
 * {"type":"retention_changed","recordedAt":"...","retentionDays":30}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JournalRecord(
    Type type,
    Instant recordedAt,
    Map<String, Object> event,   // event_added: the event in its plain map form
    Instant cutoff,              // events_cleaned
    Instant created,             // created
    Instant lastCleaned,         // created, only present after compaction
    Integer retentionDays        // created, retention_changed
) {

  public enum Type {
    @JsonProperty("created") CREATED,
    @JsonProperty("event_added") EVENT_ADDED,
    @JsonProperty("events_cleaned") EVENTS_CLEANED,
    @JsonProperty("retention_changed") RETENTION_CHANGED
  }

  public static JournalRecord created(Instant created, Instant lastCleaned, int retentionDays) {
    return new JournalRecord(Type.CREATED, created, null, null, created, lastCleaned, retentionDays);
  }

  public static JournalRecord eventAdded(Instant recordedAt, Map<String, Object> event) {
    return new JournalRecord(Type.EVENT_ADDED, recordedAt, event, null, null, null, null);
  }

  public static JournalRecord eventsCleaned(Instant cleanedAt, Instant cutoff) {
    return new JournalRecord(Type.EVENTS_CLEANED, cleanedAt, null, cutoff, null, null, null);
  }

  public static JournalRecord retentionChanged(Instant recordedAt, int retentionDays) {
    return new JournalRecord(Type.RETENTION_CHANGED, recordedAt, null, null, null, null, retentionDays);
  }
}
