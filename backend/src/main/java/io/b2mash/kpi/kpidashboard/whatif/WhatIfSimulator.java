package io.b2mash.kpi.kpidashboard.whatif;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.schedule.DerivedFieldCalculator;
import io.b2mash.kpi.kpidashboard.schedule.HierarchyAggregator;
import io.b2mash.kpi.kpidashboard.schedule.TaskDelta;
import io.b2mash.kpi.kpidashboard.store.TaskSnapshot;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Counterfactual projections over one immutable snapshot. Pure utility class: every method reads
 * its snapshot and returns a value; none of them writes to a store. Simulations that need to
 * re-run the derive and aggregate chain do so on a private {@link TaskSnapshot#toTable() copy}.
 */
public final class WhatIfSimulator {

  private WhatIfSimulator() {}

  /**
   * Projects the loss of {@code resourceName}. Its open leaf tasks become orphaned; with {@code
   * redistribute}, they are placed largest first on whichever remaining active resource carries
   * the lowest running load of remaining hours.
   */
  public static ResourceRemovalImpact removeResource(
      TaskSnapshot snapshot, String resourceName, boolean redistribute) {
    snapshot.requireResource(resourceName);
    var leaves = snapshot.leafTasks();

    List<Task> orphaned =
        leaves.stream()
            .filter(t -> resourceName.equals(t.resource()) && !t.isComplete())
            .sorted(
                Comparator.comparing(Task::hoursRemaining)
                    .reversed()
                    .thenComparing(Task::name, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    BigDecimal orphanedHours =
        orphaned.stream().map(Task::hoursRemaining).reduce(BigDecimal.ZERO, BigDecimal::add);

    if (!redistribute || orphaned.isEmpty()) {
      return new ResourceRemovalImpact(resourceName, orphaned.size(), orphanedHours, List.of());
    }

    // name -> running remaining hours; TreeMap keeps ties resolved by name
    Map<String, BigDecimal> loads = new TreeMap<>();
    snapshot.resources().stream()
        .filter(Resource::active)
        .map(Resource::name)
        .filter(name -> !name.equals(resourceName))
        .forEach(name -> loads.put(name, BigDecimal.ZERO));
    for (var task : leaves) {
      if (!task.isComplete() && task.resource() != null && loads.containsKey(task.resource())) {
        loads.merge(task.resource(), task.hoursRemaining(), BigDecimal::add);
      }
    }

    var redistribution = new ArrayList<Reassignment>();
    BigDecimal unplaced = orphanedHours;
    for (var task : orphaned) {
      Optional<String> target = leastLoaded(loads);
      if (target.isEmpty()) {
        break;
      }
      loads.merge(target.get(), task.hoursRemaining(), BigDecimal::add);
      unplaced = unplaced.subtract(task.hoursRemaining());
      redistribution.add(
          new Reassignment(
              task.id(), task.name(), resourceName, target.get(), task.hoursRemaining()));
    }
    return new ResourceRemovalImpact(
        resourceName, orphaned.size(), unplaced, List.copyOf(redistribution));
  }

  /**
   * Pushes every unfinished leaf task forward by {@code weeks × 7} calendar days. Tasks already at
   * 100% keep their dates.
   */
  public static ScheduleSlipImpact slipSchedule(TaskSnapshot snapshot, int weeks) {
    if (weeks < 0) {
      throw new InvalidStateException(
          "Invalid slip", "Weeks to slip must not be negative, but got: " + weeks);
    }
    int days = weeks * 7;
    var changes = new ArrayList<SlippedTask>();
    LocalDate currentLatest = null;
    LocalDate projectedLatest = null;
    for (var task : snapshot.leafTasks()) {
      LocalDate finish = task.finishDate();
      LocalDate projected = finish;
      if (!task.isComplete()) {
        projected = finish != null ? finish.plusDays(days) : null;
        changes.add(
            new SlippedTask(
                task.id(),
                task.name(),
                task.resource(),
                task.percentComplete(),
                task.startDate(),
                task.startDate() != null ? task.startDate().plusDays(days) : null,
                finish,
                projected));
      }
      currentLatest = later(currentLatest, finish);
      projectedLatest = later(projectedLatest, projected);
    }
    return new ScheduleSlipImpact(
        weeks, changes.size(), currentLatest, projectedLatest, List.copyOf(changes));
  }

  /**
   * Projects {@code extraHours} of added scope on a leaf task. The task is re-derived against its
   * existing percent complete and the new total, then its ancestors are re-aggregated on a private
   * copy of the snapshot.
   *
   * @throws InvalidStateException if the task has subtasks or the new total is not positive
   */
  public static AddHoursImpact addHours(TaskSnapshot snapshot, UUID taskId, BigDecimal extraHours) {
    var current = snapshot.requireTask(taskId);
    if (snapshot.hasChildren(taskId)) {
      throw new InvalidStateException(
          "Not a leaf task",
          "Task " + taskId + " has subtasks; add hours to one of its subtasks instead");
    }
    var projected =
        DerivedFieldCalculator.recalculate(
            current, TaskDelta.workHours(current.workHours().add(extraHours)));

    var copy = snapshot.toTable();
    copy.putTask(projected);
    HierarchyAggregator.rollUp(copy, projected.parentId());

    var ancestors = new ArrayList<AncestorProjection>();
    UUID ancestorId = current.parentId();
    while (ancestorId != null) {
      var before = snapshot.requireTask(ancestorId);
      var after = copy.requireTask(ancestorId);
      ancestors.add(
          new AncestorProjection(
              before.id(),
              before.name(),
              before.workHours(),
              after.workHours(),
              before.finishDate(),
              after.finishDate()));
      ancestorId = before.parentId();
    }

    return new AddHoursImpact(
        current.id(),
        current.name(),
        extraHours,
        current.percentComplete(),
        current.workHours(),
        projected.workHours(),
        current.hoursRemaining(),
        projected.hoursRemaining(),
        current.variance(),
        projected.variance(),
        current.finishDate(),
        projected.finishDate(),
        List.copyOf(ancestors));
  }

  private static Optional<String> leastLoaded(Map<String, BigDecimal> loads) {
    return loads.entrySet().stream().min(Map.Entry.comparingByValue()).map(Map.Entry::getKey);
  }

  private static LocalDate later(LocalDate a, LocalDate b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return b.isAfter(a) ? b : a;
  }
}
