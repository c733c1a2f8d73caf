package tech.yump.auditstore.storage;

/**
 * Raised when the host store cannot durably apply or read back a change
 * (journal I/O failure, unreadable journal record, invalid scope path).
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
