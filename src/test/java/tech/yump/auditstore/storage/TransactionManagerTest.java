package tech.yump.auditstore.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionManagerTest {

  private TransactionManager transactions;
  private OrderedStore<Long, String> store;
  private StoreValue<Integer> counter;

  @BeforeEach
  void setUp() {
    transactions = new TransactionManager("test-scope");
    store = transactions.newOrderedStore();
    counter = transactions.newValue(0);
  }

  @Test
  @DisplayName("Committed changes are visible to readers")
  void commit_makesChangesVisible() {
    transactions.inTransaction(tx -> {
      store.put(1L, "one");
      store.put(2L, "two");
      counter.set(2);
      return null;
    });

    assertThat(transactions.read(() -> store.keys(null, null))).containsExactly(1L, 2L);
    assertThat(transactions.read(() -> store.get(2L))).contains("two");
    assertThat(transactions.read(counter::get)).isEqualTo(2);
  }

  @Test
  @DisplayName("An exception in the body undoes every change of the transaction")
  void exceptionInBody_rollsBackAllChanges() {
    transactions.inTransaction(tx -> {
      store.put(1L, "kept");
      return null;
    });

    assertThatThrownBy(() -> transactions.inTransaction(tx -> {
      store.put(1L, "overwritten");
      store.put(2L, "added");
      store.remove(1L);
      counter.set(99);
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

    assertThat(store.keys(null, null)).containsExactly(1L);
    assertThat(store.get(1L)).contains("kept");
    assertThat(counter.get()).isZero();
  }

  @Test
  @DisplayName("A failing before-commit hook rolls the transaction back")
  void failingBeforeCommitHook_rollsBack() {
    assertThatThrownBy(() -> transactions.inTransaction(tx -> {
      store.put(5L, "five");
      tx.beforeCommit(() -> {
        throw new StorageException("disk full");
      });
      return null;
    })).isInstanceOf(StorageException.class);

    assertThat(store.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Mutating a store outside a transaction is rejected")
  void mutationOutsideTransaction_throws() {
    assertThatThrownBy(() -> store.put(1L, "x"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("outside of a transaction");
    assertThatThrownBy(() -> counter.set(1))
        .isInstanceOf(IllegalStateException.class);
    assertThat(store.size()).isZero();
  }

  @Test
  @DisplayName("Nested calls join the running transaction")
  void nestedTransaction_joinsOuter() {
    assertThatThrownBy(() -> transactions.inTransaction(tx -> {
      store.put(1L, "outer");
      transactions.inTransaction(inner -> {
        assertThat(inner).isSameAs(tx);
        store.put(2L, "inner");
        return null;
      });
      throw new IllegalArgumentException("fail after inner");
    })).isInstanceOf(IllegalArgumentException.class);

    assertThat(store.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("keys(min, max) uses inclusive bounds and returns a snapshot")
  void keys_inclusiveBoundsSnapshot() {
    transactions.inTransaction(tx -> {
      for (long k = 1; k <= 5; k++) {
        store.put(k, "v" + k);
      }
      return null;
    });

    List<Long> range = store.keys(2L, 4L);
    assertThat(range).containsExactly(2L, 3L, 4L);
    assertThat(store.keys(null, 2L)).containsExactly(1L, 2L);
    assertThat(store.keys(4L, null)).containsExactly(4L, 5L);

    transactions.inTransaction(tx -> {
      for (Long key : store.keys(null, null)) {
        store.remove(key);
      }
      return null;
    });
    assertThat(range).containsExactly(2L, 3L, 4L);
    assertThat(store.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Readers wait for a running writer and never see its partial changes")
  void reader_doesNotObservePartialWrite() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    CountDownLatch firstWriteDone = new CountDownLatch(1);
    CountDownLatch readerStarted = new CountDownLatch(1);
    try {
      Future<?> writer = executor.submit(() -> transactions.inTransaction(tx -> {
        store.put(1L, "a");
        firstWriteDone.countDown();
        try {
          readerStarted.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        store.put(2L, "b");
        return null;
      }));

      assertThat(firstWriteDone.await(5, TimeUnit.SECONDS)).isTrue();
      readerStarted.countDown();
      int seen = transactions.read(store::size);
      writer.get(5, TimeUnit.SECONDS);

      assertThat(seen).isEqualTo(2);
    } finally {
      executor.shutdownNow();
    }
  }
}
