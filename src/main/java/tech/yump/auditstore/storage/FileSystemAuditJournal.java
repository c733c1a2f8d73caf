package tech.yump.auditstore.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AuditJournal} storing each scope as a JSON-lines file under a base directory:
 * {@code <base>/<url-encoded scope>.journal.jsonl}.
 */
@Slf4j
public class FileSystemAuditJournal implements AuditJournal {

  static final String FILE_SUFFIX = ".journal.jsonl";

  private final Path basePath;
  private final ObjectMapper objectMapper;

  public FileSystemAuditJournal(ObjectMapper objectMapper, String basePath) {
    this.objectMapper = objectMapper;
    this.basePath = Paths.get(basePath).toAbsolutePath().normalize();
    log.info("FileSystemAuditJournal initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation, creating it if missing.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured journal path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured journal directory lacks read/write permissions: " + basePath);
        }
        log.debug("Journal base path validation successful: {}", basePath);
      } else {
        log.warn("Journal directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created journal directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create journal path: {}", basePath, e);
      throw new StorageException("Failed to initialize journal base path: " + basePath, e);
    }
  }

  @Override
  public void append(String scope, JournalRecord record) throws StorageException {
    if (record == null) {
      throw new IllegalArgumentException("Journal record cannot be null.");
    }
    Path journalFile = resolveJournalFile(scope);
    try {
      String line = objectMapper.writeValueAsString(record);
      Files.createDirectories(journalFile.getParent());
      try (BufferedWriter writer = Files.newBufferedWriter(journalFile, StandardCharsets.UTF_8,
              StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
        writer.write(line);
        writer.newLine();
      }
      log.debug("Appended {} record to journal of scope '{}'", record.type(), scope);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize {} journal record for scope '{}'", record.type(), scope, e);
      throw new StorageException("Failed to serialize journal record for scope: " + scope, e);
    } catch (IOException e) {
      log.error("Failed to append to journal {}: {}", journalFile, e.getMessage(), e);
      throw new StorageException("Failed to append journal record for scope: " + scope, e);
    }
  }

  @Override
  public List<JournalRecord> readAll(String scope) throws StorageException {
    Path journalFile = resolveJournalFile(scope);
    List<String> lines;
    try {
      lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      log.debug("No journal found for scope '{}' at {}", scope, journalFile);
      return List.of();
    } catch (IOException e) {
      log.error("Failed to read journal {}: {}", journalFile, e.getMessage(), e);
      throw new StorageException("Failed to read journal for scope: " + scope, e);
    }

    List<JournalRecord> records = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (!StringUtils.hasText(line)) {
        continue;
      }
      try {
        records.add(objectMapper.readValue(line, JournalRecord.class));
      } catch (JsonProcessingException e) {
        if (i == lines.size() - 1) {
          // A torn final line means the process died mid-append; that record never committed.
          log.warn("Ignoring unreadable final line {} of journal {}: {}", i + 1, journalFile, e.getOriginalMessage());
          break;
        }
        log.error("Corrupt record at line {} of journal {}", i + 1, journalFile, e);
        throw new StorageException("Corrupt journal record at line " + (i + 1) + " for scope: " + scope, e);
      }
    }
    log.info("Read {} journal record(s) for scope '{}'", records.size(), scope);
    return records;
  }

  @Override
  public void rewrite(String scope, List<JournalRecord> records) throws StorageException {
    Path journalFile = resolveJournalFile(scope);
    Path tempFile = journalFile.resolveSibling(journalFile.getFileName() + ".tmp");
    try {
      Files.createDirectories(journalFile.getParent());
      try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8,
              StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        for (JournalRecord record : records) {
          writer.write(objectMapper.writeValueAsString(record));
          writer.newLine();
        }
      }
      moveIntoPlace(tempFile, journalFile);
      log.info("Compacted journal of scope '{}' to {} record(s)", scope, records.size());
    } catch (IOException e) {
      log.error("Failed to rewrite journal {}: {}", journalFile, e.getMessage(), e);
      deleteQuietly(tempFile);
      throw new StorageException("Failed to rewrite journal for scope: " + scope, e);
    }
  }

  @Override
  public List<String> listScopes() throws StorageException {
    if (!Files.isDirectory(basePath)) {
      return List.of();
    }
    List<String> scopes = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(basePath, "*" + FILE_SUFFIX)) {
      for (Path entry : stream) {
        String fileName = entry.getFileName().toString();
        String encoded = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        scopes.add(URLDecoder.decode(encoded, StandardCharsets.UTF_8));
      }
      return scopes;
    } catch (IOException e) {
      log.error("Failed to list journals in {}: {}", basePath, e.getMessage(), e);
      throw new StorageException("Failed to list journal directory: " + basePath, e);
    }
  }

  /**
   * Maps a scope name to its journal file and checks it stays inside the base directory.
   */
  private Path resolveJournalFile(String scope) throws StorageException {
    if (!StringUtils.hasText(scope)) {
      throw new IllegalArgumentException("Scope cannot be null or empty.");
    }
    String encoded = URLEncoder.encode(scope, StandardCharsets.UTF_8);
    if (encoded.contains("..")) {
      log.error("Invalid journal scope provided: '{}'", scope);
      throw new StorageException("Invalid journal scope: " + scope);
    }
    Path journalFile = basePath.resolve(encoded + FILE_SUFFIX).normalize();
    if (!journalFile.startsWith(basePath)) {
      log.error("Path traversal attempt detected for scope '{}', resolved path '{}' is outside base path '{}'", scope, journalFile, basePath);
      throw new StorageException("Invalid scope resulting in path traversal attempt: " + scope);
    }
    return journalFile;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("Atomic move not supported for {}, falling back to plain replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary journal file {}: {}", path, e.getMessage());
    }
  }
}
