package io.b2mash.kpi.kpidashboard.schedule;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.TaskHierarchyCorruptedException;
import io.b2mash.kpi.kpidashboard.store.TaskTable;
import io.b2mash.kpi.kpidashboard.store.TaskView;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Rolls parent tasks up from their children. Pure utility class; it mutates only the table it is
 * handed.
 */
public final class HierarchyAggregator {

  private HierarchyAggregator() {}

  /**
   * Derives a parent's totals from its (already derived) children. Sums work, baseline, completed,
   * earned value and phase hours; percent is completed over work; dates span the children.
   */
  public static Task aggregate(Task parent, List<Task> children) {
    BigDecimal work = sum(children, Task::workHours);
    BigDecimal baseline = sum(children, Task::baselineHours);
    BigDecimal completed = sum(children, Task::hoursCompleted);

    int percent =
        work.signum() == 0
            ? 0
            : completed
                .multiply(Hours.HUNDRED)
                .divide(work, 0, RoundingMode.HALF_UP)
                .intValueExact();

    LocalDate start =
        children.stream()
            .map(Task::startDate)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(parent.startDate());
    LocalDate finish =
        children.stream()
            .map(Task::finishDate)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(parent.finishDate());

    return parent.toBuilder()
        .workHours(work)
        .baselineHours(baseline)
        .hoursCompleted(completed)
        .hoursRemaining(work.subtract(completed))
        .earnedValue(sum(children, Task::earnedValue))
        .variance(work.subtract(baseline))
        .percentComplete(Math.min(percent, 100))
        .devHours(sum(children, Task::devHours))
        .testHours(sum(children, Task::testHours))
        .reviewHours(sum(children, Task::reviewHours))
        .startDate(start)
        .finishDate(finish)
        .leafPlan(parent.leafPlan() != null ? parent.leafPlan() : Task.LeafPlan.of(parent))
        .build();
  }

  /**
   * Turns a former parent back into a leaf: its own plan from before it had subtasks is restored
   * and re-derived. A task that never had subtasks is returned unchanged.
   */
  public static Task restoreLeaf(Task formerParent) {
    var plan = formerParent.leafPlan();
    if (plan == null) {
      return formerParent;
    }
    var leaf =
        formerParent.toBuilder()
            .workHours(plan.workHours())
            .baselineHours(plan.baselineHours())
            .percentComplete(plan.percentComplete())
            .startDate(plan.startDate())
            .finishDate(plan.finishDate())
            .devHours(plan.devHours())
            .testHours(plan.testHours())
            .reviewHours(plan.reviewHours())
            .leafPlan(null)
            .build();
    return DerivedFieldCalculator.recalculate(
        leaf, new TaskDelta(null, null, null, plan.finishDate()));
  }

  /**
   * Re-aggregates {@code parentId} and every ancestor above it, bottom-up. A former parent left
   * without children reverts to its own leaf plan, so no roll-up total outlives the subtasks it
   * summed.
   *
   * @throws TaskHierarchyCorruptedException if the parent chain loops
   */
  public static void rollUp(TaskTable table, UUID parentId) {
    var visited = new HashSet<UUID>();
    UUID currentId = parentId;
    while (currentId != null) {
      if (!visited.add(currentId)) {
        throw new TaskHierarchyCorruptedException(currentId);
      }
      var current = table.requireTask(currentId);
      var children = table.children(currentId);
      current = children.isEmpty() ? restoreLeaf(current) : aggregate(current, children);
      table.putTask(current);
      currentId = current.parentId();
    }
  }

  /**
   * Verifies that making {@code newParentId} the parent of {@code taskId} keeps the hierarchy a
   * forest: the new parent must exist and must not be the task itself or one of its descendants.
   */
  public static void requireAcyclicParent(TaskView view, UUID taskId, UUID newParentId) {
    if (newParentId == null) {
      return;
    }
    if (newParentId.equals(taskId)) {
      throw new InvalidStateException("Invalid parent", "Task " + taskId + " cannot parent itself");
    }
    var visited = new HashSet<UUID>();
    UUID ancestorId = newParentId;
    while (ancestorId != null) {
      if (ancestorId.equals(taskId)) {
        throw new InvalidStateException(
            "Invalid parent",
            "Task " + newParentId + " is a descendant of " + taskId + "; reparenting would loop");
      }
      if (!visited.add(ancestorId)) {
        throw new TaskHierarchyCorruptedException(ancestorId);
      }
      ancestorId =
          view.findTask(ancestorId)
              .orElseThrow(
                  () ->
                      new InvalidStateException(
                          "Invalid parent", "Parent task " + newParentId + " does not exist"))
              .parentId();
    }
  }

  private static BigDecimal sum(List<Task> tasks, Function<Task, BigDecimal> field) {
    return tasks.stream()
        .map(field)
        .filter(Objects::nonNull)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
