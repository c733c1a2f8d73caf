package tech.yump.auditstore.storage;

import java.util.List;

/**
 * Write-ahead journal of committed mutations, one stream per scope.
 * Replaying a scope's records in order rebuilds its state.
 */
public interface AuditJournal {

  /**
   * Durably appends {@code record} to the scope's journal.
   *
   * @throws StorageException if the record could not be written
   */
  void append(String scope, JournalRecord record) throws StorageException;

  /**
   * Reads every record of the scope in commit order.
   *
   * @return the records, or an empty list if the scope has never been journaled
   * @throws StorageException if the journal exists but cannot be read
   */
  List<JournalRecord> readAll(String scope) throws StorageException;

  /**
   * Atomically replaces the scope's journal with {@code records}.
   * Used to compact the journal once cleanups have made older records obsolete.
   *
   * @throws StorageException if the replacement could not be written; the previous journal is kept
   */
  void rewrite(String scope, List<JournalRecord> records) throws StorageException;

  /**
   * @return every scope that has a journal
   */
  List<String> listScopes() throws StorageException;
}
