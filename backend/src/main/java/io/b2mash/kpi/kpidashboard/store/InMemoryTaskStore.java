package io.b2mash.kpi.kpidashboard.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Copy-on-write store. Writers are serialized and work on a private table; a successful write
 * swaps in a new immutable snapshot, a failed one leaves the previous snapshot in place.
 */
@Component
public class InMemoryTaskStore implements TaskStore {

  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile TaskSnapshot current = TaskSnapshot.empty();

  @Override
  public TaskSnapshot snapshot() {
    return current;
  }

  @Override
  public <T> T inTransaction(Function<TaskTable, T> work) {
    writeLock.lock();
    try {
      TaskTable table = current.toTable();
      T result = work.apply(table);
      current = table.toSnapshot();
      return result;
    } finally {
      writeLock.unlock();
    }
  }
}
