package tech.yump.auditstore.storage;

/**
 * Transactional single-value cell supplied by the host store.
 *
 * @param <T> value type, expected to be immutable
 */
public interface StoreValue<T> {

  T get();

  /**
   * Replaces the current value. Must be called inside an active transaction.
   */
  void set(T value);
}
