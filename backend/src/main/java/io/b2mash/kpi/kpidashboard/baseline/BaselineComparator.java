package io.b2mash.kpi.kpidashboard.baseline;

import io.b2mash.kpi.kpidashboard.store.TaskView;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/** Captures and diffs baselines. Pure utility class. */
public final class BaselineComparator {

  private BaselineComparator() {}

  /** Freezes the tracked fields of every task in {@code view}, keyed by task id. */
  public static Map<UUID, TaskCapture> capture(TaskView view) {
    var captures = new LinkedHashMap<UUID, TaskCapture>();
    for (var task : view.tasks()) {
      captures.put(
          task.id(),
          new TaskCapture(
              task.name(),
              task.workHours(),
              task.percentComplete(),
              task.finishDate(),
              task.variance(),
              view.hasChildren(task.id())));
    }
    return captures;
  }

  /**
   * Diffs {@code baseline} against the live tasks in {@code view}. Live tasks come first in table
   * order, followed by tasks that only exist in the baseline.
   */
  public static BaselineComparison compare(BaselineSnapshot baseline, TaskView view) {
    var captured = baseline.tasks();
    var rows = new ArrayList<TaskComparison>();
    int changed = 0;
    int added = 0;
    BigDecimal totalCurrent = BigDecimal.ZERO;

    for (var task : view.tasks()) {
      if (!view.hasChildren(task.id())) {
        totalCurrent = totalCurrent.add(task.workHours());
      }
      var capture = captured.get(task.id());
      if (capture == null) {
        added++;
        rows.add(added(task));
        continue;
      }
      var row = diff(task, capture);
      if (row.change() == BaselineChange.CHANGED) {
        changed++;
      }
      rows.add(row);
    }

    int removed = 0;
    BigDecimal totalBaseline = BigDecimal.ZERO;
    for (var entry : captured.entrySet()) {
      var capture = entry.getValue();
      if (!capture.rollup()) {
        totalBaseline = totalBaseline.add(capture.workHours());
      }
      if (view.findTask(entry.getKey()).isEmpty()) {
        removed++;
        rows.add(removed(entry.getKey(), capture));
      }
    }

    var summary =
        new ComparisonSummary(
            changed,
            added,
            removed,
            totalCurrent,
            totalBaseline,
            totalCurrent.subtract(totalBaseline));
    return new BaselineComparison(
        baseline.id(),
        baseline.name(),
        baseline.type(),
        baseline.capturedAt(),
        summary,
        List.copyOf(rows));
  }

  private static TaskComparison diff(Task task, TaskCapture capture) {
    BigDecimal hoursDelta = task.workHours().subtract(capture.workHours());
    int pctDelta = task.percentComplete() - capture.percentComplete();
    BigDecimal varianceDelta = task.variance().subtract(capture.variance());
    Long slipDays = slipDays(capture.finishDate(), task.finishDate());

    boolean unchanged =
        hoursDelta.signum() == 0
            && pctDelta == 0
            && varianceDelta.signum() == 0
            && Objects.equals(capture.finishDate(), task.finishDate());
    return new TaskComparison(
        task.id(),
        task.name(),
        unchanged ? BaselineChange.UNCHANGED : BaselineChange.CHANGED,
        capture.workHours(),
        task.workHours(),
        hoursDelta,
        pctDelta,
        varianceDelta,
        capture.finishDate(),
        task.finishDate(),
        slipDays);
  }

  private static TaskComparison added(Task task) {
    return new TaskComparison(
        task.id(),
        task.name(),
        BaselineChange.ADDED,
        null,
        task.workHours(),
        null,
        null,
        null,
        null,
        task.finishDate(),
        null);
  }

  private static TaskComparison removed(UUID taskId, TaskCapture capture) {
    return new TaskComparison(
        taskId,
        capture.taskName(),
        BaselineChange.REMOVED,
        capture.workHours(),
        null,
        null,
        null,
        null,
        capture.finishDate(),
        null,
        null);
  }

  private static Long slipDays(LocalDate baselineFinish, LocalDate currentFinish) {
    if (baselineFinish == null || currentFinish == null) {
      return null;
    }
    return ChronoUnit.DAYS.between(baselineFinish, currentFinish);
  }
}
