package io.b2mash.kpi.kpidashboard.dependency;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.ResourceConflictException;
import io.b2mash.kpi.kpidashboard.exception.ResourceNotFoundException;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import io.b2mash.kpi.kpidashboard.store.TaskView;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Maintains the task dependency graph, which stays free of self loops and cycles. */
@Service
public class DependencyService {

  private static final Logger log = LoggerFactory.getLogger(DependencyService.class);

  private final TaskStore taskStore;
  private final Clock clock;

  public DependencyService(TaskStore taskStore, Clock clock) {
    this.taskStore = taskStore;
    this.clock = clock;
  }

  public List<Dependency> listDependencies() {
    return List.copyOf(taskStore.snapshot().dependencies());
  }

  /**
   * Links {@code predecessorId} to {@code successorId}.
   *
   * @throws InvalidStateException for unknown tasks, self loops, negative lag or an edge that
   *     would close a cycle
   * @throws ResourceConflictException if the two tasks are already linked
   */
  public Dependency addDependency(
      UUID predecessorId, UUID successorId, DependencyType type, int lagDays) {
    if (lagDays < 0) {
      throw new InvalidStateException(
          "Invalid lag", "Lag days must not be negative, but got: " + lagDays);
    }
    if (predecessorId.equals(successorId)) {
      throw new InvalidStateException(
          "Invalid dependency", "Task " + predecessorId + " cannot depend on itself");
    }
    var created =
        taskStore.inTransaction(
            table -> {
              requireTaskExists(table, predecessorId);
              requireTaskExists(table, successorId);
              boolean duplicate =
                  table.dependencies().stream()
                      .anyMatch(
                          d ->
                              d.predecessorId().equals(predecessorId)
                                  && d.successorId().equals(successorId));
              if (duplicate) {
                throw new ResourceConflictException(
                    "Dependency exists",
                    "Task " + successorId + " already depends on " + predecessorId);
              }
              if (reaches(table, successorId, predecessorId)) {
                throw new InvalidStateException(
                    "Dependency cycle",
                    "Linking " + predecessorId + " to " + successorId + " would create a cycle");
              }
              var dependency =
                  new Dependency(
                      UUID.randomUUID(),
                      predecessorId,
                      successorId,
                      type != null ? type : DependencyType.FS,
                      lagDays,
                      Instant.now(clock));
              table.putDependency(dependency);
              return dependency;
            });
    log.info(
        "Added {} dependency {} from {} to {}",
        created.type(),
        created.id(),
        predecessorId,
        successorId);
    return created;
  }

  public void removeDependency(UUID dependencyId) {
    taskStore.inTransaction(
        table -> {
          if (table.findDependency(dependencyId).isEmpty()) {
            throw new ResourceNotFoundException("Dependency", dependencyId);
          }
          table.removeDependency(dependencyId);
          return null;
        });
    log.info("Removed dependency {}", dependencyId);
  }

  private static void requireTaskExists(TaskView view, UUID taskId) {
    if (view.findTask(taskId).isEmpty()) {
      throw new InvalidStateException("Unknown task", "No task found with id " + taskId);
    }
  }

  /** True when {@code target} is reachable from {@code from} along existing edges. */
  static boolean reaches(TaskView view, UUID from, UUID target) {
    var visited = new HashSet<UUID>();
    Deque<UUID> pending = new ArrayDeque<>();
    pending.push(from);
    while (!pending.isEmpty()) {
      var current = pending.pop();
      if (current.equals(target)) {
        return true;
      }
      if (!visited.add(current)) {
        continue;
      }
      for (var dependency : view.dependencies()) {
        if (dependency.predecessorId().equals(current)) {
          pending.push(dependency.successorId());
        }
      }
    }
    return false;
  }
}
