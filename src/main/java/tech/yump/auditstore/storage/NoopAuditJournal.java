package tech.yump.auditstore.storage;

import java.util.List;

/**
 * Journal used when persistence is disabled; state lives only as long as the process.
 */
public class NoopAuditJournal implements AuditJournal {

  @Override
  public void append(String scope, JournalRecord record) {
  }

  @Override
  public List<JournalRecord> readAll(String scope) {
    return List.of();
  }

  @Override
  public void rewrite(String scope, List<JournalRecord> records) {
  }

  @Override
  public List<String> listScopes() {
    return List.of();
  }
}
