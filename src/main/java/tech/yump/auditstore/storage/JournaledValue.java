package tech.yump.auditstore.storage;

import java.util.Objects;

class JournaledValue<T> implements StoreValue<T> {

  private final TransactionManager transactions;
  private T value;

  JournaledValue(TransactionManager transactions, T initial) {
    this.transactions = transactions;
    this.value = Objects.requireNonNull(initial, "initial");
  }

  @Override
  public T get() {
    return value;
  }

  @Override
  public void set(T newValue) {
    Objects.requireNonNull(newValue, "value");
    StoreTransaction tx = transactions.requireActiveTransaction();
    T previous = value;
    value = newValue;
    tx.recordUndo(() -> value = previous);
  }
}
