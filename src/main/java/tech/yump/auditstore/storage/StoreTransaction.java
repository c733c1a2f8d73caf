package tech.yump.auditstore.storage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * One atomic unit of work against a scope's stores.
 * Collects the inverse of every mutation so the whole unit can be undone,
 * and the hooks that must succeed before the unit counts as committed.
 */
public final class StoreTransaction {

  private final Deque<Runnable> undoLog = new ArrayDeque<>();
  private final List<Runnable> beforeCommitHooks = new ArrayList<>();

  StoreTransaction() {
  }

  void recordUndo(Runnable undo) {
    undoLog.push(undo);
  }

  /**
   * Registers work that runs after the transaction body and before it commits.
   * If the hook throws, every change made by the transaction is rolled back.
   */
  public void beforeCommit(Runnable hook) {
    beforeCommitHooks.add(hook);
  }

  /**
   * @return number of store mutations recorded so far
   */
  public int changeCount() {
    return undoLog.size();
  }

  void runBeforeCommitHooks() {
    for (Runnable hook : beforeCommitHooks) {
      hook.run();
    }
  }

  int rollback() {
    int undone = 0;
    while (!undoLog.isEmpty()) {
      undoLog.pop().run();
      undone++;
    }
    return undone;
  }
}
