package io.b2mash.kpi.kpidashboard;

import io.b2mash.kpi.kpidashboard.phase.PhaseDistributor;
import io.b2mash.kpi.kpidashboard.phase.PhaseRatios;
import io.b2mash.kpi.kpidashboard.resource.LeadPreference;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.schedule.DerivedFieldCalculator;
import io.b2mash.kpi.kpidashboard.schedule.HierarchyAggregator;
import io.b2mash.kpi.kpidashboard.schedule.TaskDelta;
import io.b2mash.kpi.kpidashboard.store.InMemoryTaskStore;
import io.b2mash.kpi.kpidashboard.store.TaskSnapshot;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Builders for fully derived tasks and seeded stores used across unit tests. */
public final class TestTasks {

  private TestTasks() {}

  public static Task leaf(
      String name,
      String resource,
      String workHours,
      String baselineHours,
      int percentComplete,
      LocalDate start,
      LocalDate finish) {
    return child(null, name, resource, workHours, baselineHours, percentComplete, start, finish);
  }

  public static Task child(
      UUID parentId,
      String name,
      String resource,
      String workHours,
      String baselineHours,
      int percentComplete,
      LocalDate start,
      LocalDate finish) {
    var draft =
        Task.builder()
            .id(UUID.randomUUID())
            .name(name)
            .resource(resource)
            .baselineHours(new BigDecimal(baselineHours))
            .startDate(start)
            .finishDate(finish)
            .parentId(parentId)
            .build();
    draft = PhaseDistributor.initialSplit(draft, new BigDecimal(workHours), PhaseRatios.DEFAULT);
    return DerivedFieldCalculator.recalculate(
        draft, new TaskDelta(null, percentComplete, null, finish));
  }

  /** A task meant to become a parent; its numbers are replaced by the roll-up. */
  public static Task parent(String name, LocalDate start) {
    return leaf(name, null, "1", "1", 0, start, start);
  }

  public static Resource resource(String name, String capacityHoursPerWeek) {
    return new Resource(name, new BigDecimal(capacityHoursPerWeek), true, LeadPreference.ASK);
  }

  public static InMemoryTaskStore store(Collection<Resource> resources, Task... tasks) {
    var store = new InMemoryTaskStore();
    store.inTransaction(
        table -> {
          resources.forEach(table::putResource);
          for (var task : tasks) {
            table.putTask(task);
          }
          List.of(tasks).stream()
              .map(Task::parentId)
              .filter(Objects::nonNull)
              .distinct()
              .forEach(parentId -> HierarchyAggregator.rollUp(table, parentId));
          return null;
        });
    return store;
  }

  public static TaskSnapshot snapshot(Collection<Resource> resources, Task... tasks) {
    return store(resources, tasks).snapshot();
  }
}
