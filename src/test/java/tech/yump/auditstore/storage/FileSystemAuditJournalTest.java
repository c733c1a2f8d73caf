package tech.yump.auditstore.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemAuditJournalTest {

  @TempDir
  Path tempJournalDir;

  private FileSystemAuditJournal journal;

  private final Instant created = Instant.parse("2026-10-01T00:00:00Z");

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    journal = new FileSystemAuditJournal(objectMapper, tempJournalDir.toString());
    journal.validateBasePath();
  }

  private static Map<String, Object> event(String id) {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("event_id", id);
    event.put("timestamp", "2026-10-02T10:00:00.123456+00:00");
    event.put("user_id", "alice");
    event.put("action_type", "authentication_success");
    event.put("outcome", "success");
    event.put("metadata", Map.of("credential_id", "cred-1"));
    return event;
  }

  @Test
  @DisplayName("Appended records are read back in order")
  void append_thenReadAll_returnsRecordsInOrder() {
    journal.append("site", JournalRecord.created(created, null, 90));
    journal.append("site", JournalRecord.eventAdded(created.plusSeconds(5), event("e-1")));
    journal.append("site", JournalRecord.retentionChanged(created.plusSeconds(10), 30));

    List<JournalRecord> records = journal.readAll("site");

    assertEquals(3, records.size());
    assertThat(records).extracting(JournalRecord::type).containsExactly(
        JournalRecord.Type.CREATED, JournalRecord.Type.EVENT_ADDED, JournalRecord.Type.RETENTION_CHANGED);
    assertThat(records.get(0).created()).isEqualTo(created);
    assertThat(records.get(0).retentionDays()).isEqualTo(90);
    assertThat(records.get(1).event()).containsEntry("event_id", "e-1").containsEntry("user_id", "alice");
    assertThat(records.get(2).retentionDays()).isEqualTo(30);
  }

  @Test
  @DisplayName("A scope without journal reads as empty")
  void readAll_missingScope_returnsEmpty() {
    assertThat(journal.readAll("never-written")).isEmpty();
  }

  @Test
  @DisplayName("A torn final line is ignored")
  void readAll_tornFinalLine_isIgnored() throws IOException {
    journal.append("site", JournalRecord.created(created, null, 90));
    Path file = tempJournalDir.resolve("site" + FileSystemAuditJournal.FILE_SUFFIX);
    Files.writeString(file, "{\"type\":\"event_added\",\"recordedAt\":", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    List<JournalRecord> records = journal.readAll("site");

    assertThat(records).hasSize(1);
    assertThat(records.get(0).type()).isEqualTo(JournalRecord.Type.CREATED);
  }

  @Test
  @DisplayName("A corrupt record before the end of the journal is an error")
  void readAll_corruptMiddleLine_throws() throws IOException {
    Path file = tempJournalDir.resolve("site" + FileSystemAuditJournal.FILE_SUFFIX);
    journal.append("site", JournalRecord.created(created, null, 90));
    Files.writeString(file, "not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    journal.append("site", JournalRecord.retentionChanged(created, 10));

    assertThatThrownBy(() -> journal.readAll("site"))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  @DisplayName("rewrite replaces the whole journal")
  void rewrite_replacesContent() {
    journal.append("site", JournalRecord.created(created, null, 90));
    journal.append("site", JournalRecord.eventAdded(created, event("old")));
    journal.append("site", JournalRecord.eventsCleaned(created.plusSeconds(60), created.plusSeconds(1)));

    Instant cleaned = created.plusSeconds(60);
    journal.rewrite("site", List.of(JournalRecord.created(created, cleaned, 90)));

    List<JournalRecord> records = journal.readAll("site");
    assertThat(records).hasSize(1);
    assertThat(records.get(0).lastCleaned()).isEqualTo(cleaned);
    assertThat(tempJournalDir.resolve("site" + FileSystemAuditJournal.FILE_SUFFIX + ".tmp")).doesNotExist();
  }

  @Test
  @DisplayName("Scope names are encoded into file names and decoded by listScopes")
  void listScopes_decodesEncodedNames() {
    journal.append("plone/site one", JournalRecord.created(created, null, 90));
    journal.append("intranet", JournalRecord.created(created, null, 90));

    assertThat(journal.listScopes()).containsExactlyInAnyOrder("plone/site one", "intranet");
    assertTrue(Files.exists(tempJournalDir.resolve("plone%2Fsite+one" + FileSystemAuditJournal.FILE_SUFFIX)));
  }

  @Test
  @DisplayName("Scopes that would escape the base directory are rejected")
  void invalidScope_isRejected() {
    assertThatThrownBy(() -> journal.append("..", JournalRecord.created(created, null, 90)))
        .isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> journal.readAll(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("A base path that is a regular file fails validation")
  void validateBasePath_fileInsteadOfDirectory_throws() throws IOException {
    Path file = Files.createFile(tempJournalDir.resolve("not-a-dir"));
    FileSystemAuditJournal misconfigured = new FileSystemAuditJournal(new ObjectMapper(), file.toString());

    assertThatThrownBy(misconfigured::validateBasePath)
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("not a directory");
  }
}
