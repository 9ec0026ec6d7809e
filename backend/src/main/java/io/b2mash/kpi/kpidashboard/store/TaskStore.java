package io.b2mash.kpi.kpidashboard.store;

import java.util.function.Function;

/**
 * Storage collaborator of the engine. Reads see one committed snapshot; writes run as a single
 * transaction that is published only if it completes without throwing.
 */
public interface TaskStore {

  TaskSnapshot snapshot();

  <T> T inTransaction(Function<TaskTable, T> work);
}
