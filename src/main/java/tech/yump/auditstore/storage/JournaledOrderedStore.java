package tech.yump.auditstore.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory {@link OrderedStore} whose mutations are recorded in the active
 * {@link StoreTransaction} so they can be undone on rollback.
 */
class JournaledOrderedStore<K extends Comparable<? super K>, V> implements OrderedStore<K, V> {

  private final TransactionManager transactions;
  private final TreeMap<K, V> entries = new TreeMap<>();

  JournaledOrderedStore(TransactionManager transactions) {
    this.transactions = transactions;
  }

  @Override
  public Optional<V> get(K key) {
    return Optional.ofNullable(entries.get(Objects.requireNonNull(key, "key")));
  }

  @Override
  public void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    StoreTransaction tx = transactions.requireActiveTransaction();
    V previous = entries.put(key, value);
    if (previous == null) {
      tx.recordUndo(() -> entries.remove(key));
    } else {
      tx.recordUndo(() -> entries.put(key, previous));
    }
  }

  @Override
  public boolean remove(K key) {
    Objects.requireNonNull(key, "key");
    StoreTransaction tx = transactions.requireActiveTransaction();
    V previous = entries.remove(key);
    if (previous == null) {
      return false;
    }
    tx.recordUndo(() -> entries.put(key, previous));
    return true;
  }

  @Override
  public boolean containsKey(K key) {
    return entries.containsKey(Objects.requireNonNull(key, "key"));
  }

  @Override
  public List<K> keys(K min, K max) {
    if (min != null && max != null && min.compareTo(max) > 0) {
      return List.of();
    }
    NavigableMap<K, V> view = entries;
    if (min != null) {
      view = view.tailMap(min, true);
    }
    if (max != null) {
      view = view.headMap(max, true);
    }
    return new ArrayList<>(view.keySet());
  }

  @Override
  public int size() {
    return entries.size();
  }
}
