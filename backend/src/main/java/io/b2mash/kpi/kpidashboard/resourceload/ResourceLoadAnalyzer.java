package io.b2mash.kpi.kpidashboard.resourceload;

import io.b2mash.kpi.kpidashboard.resource.Resource;
import io.b2mash.kpi.kpidashboard.schedule.Hours;
import io.b2mash.kpi.kpidashboard.schedule.IntervalSpread;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Buckets each resource's task hours into consecutive periods starting with the period that
 * contains "today". Pure utility class with no Spring dependencies.
 *
 * <p>Hours are spread over each task's date span the same way the S-curve spreads them, so a
 * period receives the share of the task's days that fall inside it.
 */
public final class ResourceLoadAnalyzer {

  private ResourceLoadAnalyzer() {}

  /**
   * @param resources resources to report on; inactive ones are skipped
   * @param leafTasks leaf tasks; parent rows would double count their children
   * @param period bucket width
   * @param periodCount number of buckets in the window, at least 1
   * @param today reference date anchoring the first bucket
   * @param view which hours to count
   */
  public static ResourceLoadReport analyze(
      Collection<Resource> resources,
      Collection<Task> leafTasks,
      LoadPeriod period,
      int periodCount,
      LocalDate today,
      LoadView view) {
    if (periodCount < 1) {
      throw new IllegalArgumentException("periodCount must be at least 1, but got: " + periodCount);
    }
    var starts = new ArrayList<LocalDate>(periodCount);
    var labels = new ArrayList<String>(periodCount);
    var periodStart = period.periodStart(today);
    for (int i = 0; i < periodCount; i++) {
      starts.add(periodStart);
      labels.add(period.label(periodStart));
      periodStart = period.next(periodStart);
    }
    LocalDate windowEnd = periodStart;

    var rows = new ArrayList<ResourceLoadRow>();
    for (var resource : resources) {
      if (!resource.active()) {
        continue;
      }
      var assigned =
          leafTasks.stream()
              .filter(t -> resource.name().equals(t.resource()))
              .filter(t -> view == LoadView.ALLOCATION || !t.isComplete())
              .toList();
      double[] completed =
          view == LoadView.ALLOCATION
              ? bucket(assigned, starts, windowEnd, t -> t.hoursCompleted().doubleValue())
              : new double[periodCount];
      double[] remaining =
          bucket(assigned, starts, windowEnd, t -> t.hoursRemaining().doubleValue());
      rows.add(toRow(resource, period, completed, remaining));
    }
    return new ResourceLoadReport(period, view, labels, starts, rows);
  }

  private static ResourceLoadRow toRow(
      Resource resource, LoadPeriod period, double[] completed, double[] remaining) {
    double perPeriod = resource.capacityFor(period).doubleValue();
    double capacity = perPeriod * remaining.length;
    double completedTotal = 0;
    double remainingTotal = 0;
    boolean overallocated = false;
    var periods = new ArrayList<Double>(remaining.length);
    for (int i = 0; i < remaining.length; i++) {
      double allocated = completed[i] + remaining[i];
      completedTotal += completed[i];
      remainingTotal += remaining[i];
      overallocated |= allocated > perPeriod;
      periods.add(Hours.round(allocated));
    }
    double allocatedTotal = completedTotal + remainingTotal;
    double utilization = capacity > 0 ? allocatedTotal / capacity * 100 : 0;
    return new ResourceLoadRow(
        resource.name(),
        Hours.round(capacity),
        Hours.round(completedTotal),
        Hours.round(remainingTotal),
        Hours.round(Math.max(0, capacity - allocatedTotal)),
        Hours.round(utilization),
        overallocated,
        Hours.round(perPeriod),
        List.copyOf(periods));
  }

  private static double[] bucket(
      List<Task> tasks,
      List<LocalDate> starts,
      LocalDate windowEnd,
      ToDoubleFunction<Task> hours) {
    double[] buckets = new double[starts.size()];
    for (var task : tasks) {
      double taskHours = hours.applyAsDouble(task);
      if (taskHours == 0) {
        continue;
      }
      for (int i = 0; i < starts.size(); i++) {
        LocalDate periodEnd =
            (i + 1 < starts.size() ? starts.get(i + 1) : windowEnd).minusDays(1);
        double share =
            IntervalSpread.share(task.startDate(), task.finishDate(), starts.get(i), periodEnd);
        buckets[i] += taskHours * share;
      }
    }
    return buckets;
  }
}
