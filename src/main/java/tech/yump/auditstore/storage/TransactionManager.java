package tech.yump.auditstore.storage;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Commit boundary for one scope. Writers are serialized and run with an undo log;
 * readers share a read lock and therefore only ever see committed state.
 */
@Slf4j
public class TransactionManager implements StoreFactory {

  private final String name;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  // guarded by the write lock
  private StoreTransaction active;

  public TransactionManager(String name) {
    this.name = name;
  }

  /**
   * Runs {@code work} as a single atomic mutation. Any exception thrown by the body
   * or by a before-commit hook undoes every change of the transaction and is rethrown.
   * A call made while the current thread already runs a transaction joins it.
   */
  public <T> T inTransaction(Function<StoreTransaction, T> work) {
    if (lock.isWriteLockedByCurrentThread() && active != null) {
      return work.apply(active);
    }

    lock.writeLock().lock();
    StoreTransaction tx = new StoreTransaction();
    active = tx;
    try {
      T result = work.apply(tx);
      tx.runBeforeCommitHooks();
      return result;
    } catch (RuntimeException | Error e) {
      int undone = tx.rollback();
      log.warn("Transaction on '{}' rolled back, {} change(s) undone: {}", name, undone, e.getMessage());
      throw e;
    } finally {
      active = null;
      lock.writeLock().unlock();
    }
  }

  /**
   * Runs {@code work} against committed state.
   */
  public <T> T read(Supplier<T> work) {
    lock.readLock().lock();
    try {
      return work.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  StoreTransaction requireActiveTransaction() {
    if (!lock.isWriteLockedByCurrentThread() || active == null) {
      throw new IllegalStateException("Store mutation attempted outside of a transaction on '" + name + "'");
    }
    return active;
  }

  @Override
  public <K extends Comparable<? super K>, V> OrderedStore<K, V> newOrderedStore() {
    return new JournaledOrderedStore<>(this);
  }

  @Override
  public <T> StoreValue<T> newValue(T initial) {
    return new JournaledValue<>(this, initial);
  }

  public String getName() {
    return name;
  }
}
