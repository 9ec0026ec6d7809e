package io.b2mash.kpi.kpidashboard.exception;

import java.util.UUID;

/**
 * Signals that a parent chain revisited a task during roll-up. Parent assignments are checked
 * before they are stored, so reaching this means the store was seeded with a cycle.
 */
public class TaskHierarchyCorruptedException extends RuntimeException {

  public TaskHierarchyCorruptedException(UUID taskId) {
    super("Parent chain revisits task " + taskId);
  }
}
