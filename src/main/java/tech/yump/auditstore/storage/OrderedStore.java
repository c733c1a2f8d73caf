package tech.yump.auditstore.storage;

import java.util.List;
import java.util.Optional;

/**
 * Sorted associative container supplied by the host store.
 * Iteration order is the natural ascending order of the keys.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface OrderedStore<K extends Comparable<? super K>, V> {

  /**
   * @param key lookup key, must not be null
   * @return the value stored under {@code key}, or empty if absent
   */
  Optional<V> get(K key);

  /**
   * Stores {@code value} under {@code key}, replacing any previous value.
   * Must be called inside an active transaction.
   */
  void put(K key, V value);

  /**
   * Removes the entry for {@code key}. Must be called inside an active transaction.
   *
   * @return true if an entry was removed
   */
  boolean remove(K key);

  boolean containsKey(K key);

  /**
   * Returns a snapshot of the keys in {@code [min, max]}, ascending.
   *
   * @param min inclusive lower bound, null for unbounded
   * @param max inclusive upper bound, null for unbounded
   * @return the keys in range; later mutations do not affect the returned list
   */
  List<K> keys(K min, K max);

  int size();

  default boolean isEmpty() {
    return size() == 0;
  }
}
