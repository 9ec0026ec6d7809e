package io.b2mash.kpi.kpidashboard.task;

import io.b2mash.kpi.kpidashboard.config.EngineProperties;
import io.b2mash.kpi.kpidashboard.exception.DerivedFieldEditException;
import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.exception.ResourceConflictException;
import io.b2mash.kpi.kpidashboard.phase.PhaseDistributor;
import io.b2mash.kpi.kpidashboard.phase.PhaseRatios;
import io.b2mash.kpi.kpidashboard.phase.PhaseRescale;
import io.b2mash.kpi.kpidashboard.resource.LeadPreference;
import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.schedule.DerivedFieldCalculator;
import io.b2mash.kpi.kpidashboard.schedule.HierarchyAggregator;
import io.b2mash.kpi.kpidashboard.schedule.Hours;
import io.b2mash.kpi.kpidashboard.schedule.TaskDelta;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import io.b2mash.kpi.kpidashboard.store.TaskTable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The engine's write surface. Every method runs one store transaction: validate, derive the edited
 * leaf, roll the change up through its ancestors, commit. A rejected call commits nothing.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskStore taskStore;
  private final EngineProperties engineProperties;
  private final Clock clock;

  public TaskService(TaskStore taskStore, EngineProperties engineProperties, Clock clock) {
    this.taskStore = taskStore;
    this.engineProperties = engineProperties;
    this.clock = clock;
  }

  public List<Task> listTasks() {
    return List.copyOf(taskStore.snapshot().tasks());
  }

  public Task getTask(UUID taskId) {
    return taskStore.snapshot().requireTask(taskId);
  }

  /**
   * Creates a task and splits its work over the phases using the resource's lead ratios, or the
   * configured defaults. Without a finish date the finish is projected from the start.
   */
  public Task createTask(
      String name,
      String resource,
      BigDecimal workHours,
      BigDecimal baselineHours,
      Integer percentComplete,
      LocalDate startDate,
      LocalDate finishDate,
      UUID parentId,
      TaskPhase currentPhase) {
    var created =
        taskStore.inTransaction(
            table -> {
              UUID id = UUID.randomUUID();
              String resourceName = resolveResource(table, resource);
              DerivedFieldCalculator.requirePositiveWork(workHours);
              int percent = percentComplete != null ? percentComplete : 0;
              DerivedFieldCalculator.requireValidPercent(percent);
              if (startDate == null) {
                throw new InvalidStateException("Invalid dates", "Task start date is required");
              }
              HierarchyAggregator.requireAcyclicParent(table, id, parentId);
              BigDecimal baseline = baselineHours != null ? baselineHours : workHours;
              if (baseline.signum() < 0) {
                throw new InvalidStateException(
                    "Invalid baseline hours", "Baseline hours must not be negative");
              }

              var draft =
                  Task.builder()
                      .id(id)
                      .name(requireName(name))
                      .resource(resourceName)
                      .baselineHours(Hours.round(baseline))
                      .percentComplete(percent)
                      .startDate(startDate)
                      .finishDate(finishDate != null ? finishDate : startDate)
                      .parentId(parentId)
                      .currentPhase(currentPhase != null ? currentPhase : TaskPhase.DEVELOPMENT)
                      .updatedAt(Instant.now(clock))
                      .build();
              draft =
                  PhaseDistributor.initialSplit(draft, workHours, ratiosFor(table, resourceName));
              var task =
                  DerivedFieldCalculator.recalculate(
                      draft, new TaskDelta(draft.workHours(), percent, startDate, finishDate));

              table.putTask(task);
              HierarchyAggregator.rollUp(table, parentId);
              return task;
            });
    log.info("Created task {} ({}) under parent {}", created.id(), created.name(), parentId);
    return created;
  }

  /**
   * Applies an edit of authoritative fields. A work-hour change on a leaf needs a phase rescale:
   * the one passed in, else the resource's lead preference; when neither names one the edit is
   * rejected rather than defaulted.
   *
   * @throws InvalidStateException on an empty update, invalid values, or attempts to write
   *     always-derived fields
   * @throws DerivedFieldEditException when the task has subtasks and the edit touches rolled-up
   *     fields
   */
  public Task applyFieldUpdate(UUID taskId, TaskFieldUpdate update, PhaseRescale rescale) {
    var updated =
        taskStore.inTransaction(
            table -> {
              var current = table.requireTask(taskId);
              if (update.isEmpty()) {
                throw new InvalidStateException(
                    "Empty update", "The update for task " + taskId + " names no field");
              }
              var readOnly = update.readOnlyFieldsPresent();
              if (!readOnly.isEmpty()) {
                throw new InvalidStateException(
                    "Read-only fields", "Fields " + readOnly + " are calculated and not editable");
              }
              boolean isParent = table.hasChildren(taskId);
              if (isParent && !update.rollupFieldsPresent().isEmpty()) {
                throw new DerivedFieldEditException(taskId, update.rollupFieldsPresent());
              }

              var builder = current.toBuilder().updatedAt(Instant.now(clock));
              if (update.name() != null) {
                builder.name(requireName(update.name()));
              }
              if (update.resource() != null) {
                builder.resource(resolveResource(table, update.resource()));
              }
              if (update.currentPhase() != null) {
                builder.currentPhase(update.currentPhase());
              }
              UUID oldParentId = current.parentId();
              UUID newParentId = oldParentId;
              if (Boolean.TRUE.equals(update.detachFromParent())) {
                newParentId = null;
              } else if (update.parentId() != null) {
                HierarchyAggregator.requireAcyclicParent(table, taskId, update.parentId());
                newParentId = update.parentId();
              }
              builder.parentId(newParentId);

              var next = builder.build();
              if (!isParent) {
                next = recalculateLeaf(table, next, update, rescale);
              }
              table.putTask(next);

              if (!Objects.equals(oldParentId, newParentId) && oldParentId != null) {
                HierarchyAggregator.rollUp(table, oldParentId);
              }
              HierarchyAggregator.rollUp(table, newParentId);
              return table.requireTask(taskId);
            });
    log.info(
        "Updated task {}: workHours={}, percentComplete={}, finishDate={}",
        taskId,
        updated.workHours(),
        updated.percentComplete(),
        updated.finishDate());
    return updated;
  }

  /** Scales every phase by {@code newWorkHours / workHours}. */
  public Task rescaleProportional(UUID taskId, BigDecimal newWorkHours) {
    var updated =
        updateLeaf(
            taskId,
            (table, task) ->
                DerivedFieldCalculator.recalculate(
                    PhaseDistributor.rescaleProportional(task, newWorkHours),
                    TaskDelta.workHours(newWorkHours)));
    log.info("Rescaled task {} proportionally to {}h", taskId, updated.workHours());
    return updated;
  }

  /** Adds {@code deltaHours} to one phase; work hours follow the phase sum. */
  public Task addHoursToPhase(UUID taskId, TaskPhase phase, BigDecimal deltaHours) {
    if (phase == null) {
      throw new InvalidStateException("Invalid phase", "A phase is required");
    }
    var updated =
        updateLeaf(
            taskId,
            (table, task) -> {
              var adjusted = PhaseDistributor.addToPhase(task, phase, deltaHours);
              return DerivedFieldCalculator.recalculate(
                  adjusted, TaskDelta.workHours(adjusted.workHours()));
            });
    log.info("Added {}h to {} of task {}", deltaHours, phase.value(), taskId);
    return updated;
  }

  /**
   * Records completed work. Progress becomes completed over work; when the logged hours overrun
   * the planned work, work grows to match through the given (or preferred) rescale.
   */
  public Task logHours(UUID taskId, BigDecimal hours, PhaseRescale rescale) {
    if (hours == null || hours.signum() <= 0) {
      throw new InvalidStateException(
          "Invalid hours", "Logged hours must be greater than 0, but got: " + hours);
    }
    var updated =
        updateLeaf(
            taskId,
            (table, task) -> {
              BigDecimal completed = task.hoursCompleted().add(hours);
              var next = task;
              if (completed.compareTo(task.workHours()) > 0) {
                next =
                    PhaseDistributor.rescale(
                        task, completed, requireRescale(table, task, rescale, completed));
              }
              int percent =
                  Math.min(
                      completed
                          .multiply(Hours.HUNDRED)
                          .divide(next.workHours(), 0, RoundingMode.HALF_UP)
                          .intValueExact(),
                      100);
              return DerivedFieldCalculator.recalculate(
                  next, new TaskDelta(next.workHours(), percent, null, null));
            });
    log.info("Logged {}h on task {}, now {}% complete", hours, taskId, updated.percentComplete());
    return updated;
  }

  /**
   * Deletes a leaf task together with every dependency edge that references it, then re-derives
   * its former ancestors.
   */
  public void deleteTask(UUID taskId) {
    var removed =
        taskStore.inTransaction(
            table -> {
              var task = table.requireTask(taskId);
              if (table.hasChildren(taskId)) {
                throw new ResourceConflictException(
                    "Task has subtasks",
                    "Task " + taskId + " has subtasks; delete or move them first");
              }
              table.removeTask(taskId);
              HierarchyAggregator.rollUp(table, task.parentId());
              return task;
            });
    log.info("Deleted task {} ({})", taskId, removed.name());
  }

  // --- internals ---

  private Task recalculateLeaf(
      TaskTable table, Task task, TaskFieldUpdate update, PhaseRescale rescale) {
    var next = task;
    boolean workTouched = update.workHours() != null;
    if (update.touchesPhaseHours()) {
      next =
          PhaseDistributor.setPhaseHours(
              next, update.devHours(), update.testHours(), update.reviewHours());
      if (workTouched && Hours.round(update.workHours()).compareTo(next.workHours()) != 0) {
        throw new InvalidStateException(
            "Inconsistent work hours",
            "Work hours "
                + update.workHours()
                + " do not match the phase total "
                + next.workHours());
      }
      workTouched = true;
    } else if (workTouched) {
      DerivedFieldCalculator.requirePositiveWork(update.workHours());
      if (Hours.round(update.workHours()).compareTo(task.workHours()) != 0) {
        var strategy = requireRescale(table, task, rescale, update.workHours());
        next = PhaseDistributor.rescale(next, update.workHours(), strategy);
      }
    }
    var delta =
        new TaskDelta(
            workTouched ? next.workHours() : null,
            update.percentComplete(),
            update.startDate(),
            update.finishDate());
    return DerivedFieldCalculator.recalculate(next, delta);
  }

  private Task updateLeaf(UUID taskId, LeafEdit edit) {
    return taskStore.inTransaction(
        table -> {
          var task = table.requireTask(taskId);
          if (table.hasChildren(taskId)) {
            throw new DerivedFieldEditException(taskId, List.of("workHours"));
          }
          var next = edit.apply(table, task).toBuilder().updatedAt(Instant.now(clock)).build();
          table.putTask(next);
          HierarchyAggregator.rollUp(table, next.parentId());
          return next;
        });
  }

  private PhaseRescale requireRescale(
      TaskTable table, Task task, PhaseRescale requested, BigDecimal newWorkHours) {
    if (requested != null) {
      return requested;
    }
    return leadPreferenceOf(table, task.resource())
        .defaultRescale()
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Rescale required",
                    "Work hours of task "
                        + task.id()
                        + " change from "
                        + task.workHours()
                        + " to "
                        + newWorkHours
                        + "; choose 'proportional' or 'targeted:<phase>'"));
  }

  private PhaseRatios ratiosFor(TaskTable table, String resourceName) {
    var ratios = leadPreferenceOf(table, resourceName).ratios();
    if (ratios != null) {
      return ratios;
    }
    return new PhaseRatios(
        engineProperties.developmentRatio(),
        engineProperties.testingRatio(),
        engineProperties.reviewRatio());
  }

  private static LeadPreference leadPreferenceOf(TaskTable table, String resourceName) {
    if (resourceName == null) {
      return LeadPreference.ASK;
    }
    return table
        .findResource(resourceName)
        .map(Resource::leadPreference)
        .filter(Objects::nonNull)
        .orElse(LeadPreference.ASK);
  }

  private static String resolveResource(TaskTable table, String resource) {
    if (resource == null || resource.isBlank()) {
      return null;
    }
    String name = resource.trim();
    if (table.findResource(name).isEmpty()) {
      throw new InvalidStateException("Unknown resource", "No resource named '" + name + "'");
    }
    return name;
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid task name", "Task name must not be blank");
    }
    return name.trim();
  }

  @FunctionalInterface
  private interface LeafEdit {
    Task apply(TaskTable table, Task task);
  }
}
