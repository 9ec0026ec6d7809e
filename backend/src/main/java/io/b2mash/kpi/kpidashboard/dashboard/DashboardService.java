package io.b2mash.kpi.kpidashboard.dashboard;

import io.b2mash.kpi.kpidashboard.milestone.Milestone;
import io.b2mash.kpi.kpidashboard.schedule.Hours;
import io.b2mash.kpi.kpidashboard.store.TaskStore;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Service;

@Service
public class DashboardService {

  private final TaskStore taskStore;

  public DashboardService(TaskStore taskStore) {
    this.taskStore = taskStore;
  }

  public PortfolioSummary summary() {
    var leaves = taskStore.snapshot().leafTasks();
    double averagePercent =
        leaves.stream().mapToInt(Task::percentComplete).average().orElse(0.0);
    BigDecimal work = sum(leaves, Task::workHours);
    BigDecimal baseline = sum(leaves, Task::baselineHours);
    return new PortfolioSummary(
        leaves.size(),
        work,
        baseline,
        work.subtract(baseline),
        Hours.round(averagePercent),
        sum(leaves, Task::hoursCompleted),
        sum(leaves, Task::hoursRemaining),
        sum(leaves, Task::earnedValue));
  }

  /** Tasks ordered by start date, milestones by date. */
  public Timeline timeline() {
    var snapshot = taskStore.snapshot();
    var tasks =
        snapshot.tasks().stream()
            .sorted(
                Comparator.comparing(
                    Task::startDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    var milestones =
        snapshot.milestones().stream().sorted(Comparator.comparing(Milestone::date)).toList();
    return new Timeline(tasks, List.copyOf(snapshot.dependencies()), milestones);
  }

  private static BigDecimal sum(List<Task> tasks, Function<Task, BigDecimal> field) {
    return tasks.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
