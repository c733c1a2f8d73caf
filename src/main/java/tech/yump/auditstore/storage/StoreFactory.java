package tech.yump.auditstore.storage;

/**
 * Creates the transactional containers a scope's data lives in.
 */
public interface StoreFactory {

  <K extends Comparable<? super K>, V> OrderedStore<K, V> newOrderedStore();

  /**
   * Creates a cell holding {@code initial}. Setting the initial value is not journaled.
   */
  <T> StoreValue<T> newValue(T initial);
}
