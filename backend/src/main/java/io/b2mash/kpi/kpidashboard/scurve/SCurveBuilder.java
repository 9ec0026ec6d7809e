package io.b2mash.kpi.kpidashboard.scurve;

import io.b2mash.kpi.kpidashboard.schedule.Hours;
import io.b2mash.kpi.kpidashboard.schedule.IntervalSpread;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Builds baseline, scheduled and earned cumulative series over uniform date bins. Pure utility
 * class with no Spring dependencies.
 *
 * <p>Each task's hours are spread linearly over its inclusive date span and summed per bin before
 * the running total is taken. Earned value accumulates only through bins that end on or before
 * "today"; later bins repeat the last earned total.
 */
public final class SCurveBuilder {

  private SCurveBuilder() {}

  /**
   * @param tasks leaf tasks to chart; parents must be excluded by the caller
   * @param binDays bin width in calendar days, at least 1
   * @param today reference date separating actual from future bins
   */
  public static SCurve build(Collection<Task> tasks, int binDays, LocalDate today) {
    if (binDays < 1) {
      throw new IllegalArgumentException("binDays must be at least 1, but got: " + binDays);
    }
    var dated =
        tasks.stream().filter(t -> t.startDate() != null && t.finishDate() != null).toList();
    if (dated.isEmpty()) {
      return SCurve.empty(null);
    }

    LocalDate axisStart =
        dated.stream().map(Task::startDate).min(Comparator.naturalOrder()).orElseThrow();
    LocalDate axisEnd =
        dated.stream().map(Task::finishDate).max(Comparator.naturalOrder()).orElseThrow();
    var bins = bins(axisStart, axisEnd, binDays);

    double[] baselinePerBin = spread(dated, bins, t -> t.baselineHours().doubleValue());
    double[] scheduledPerBin = spread(dated, bins, t -> t.workHours().doubleValue());
    double[] earnedPerBin = spread(dated, bins, t -> t.earnedValue().doubleValue());

    var labels = new ArrayList<LocalDate>(bins.size());
    var baseline = new ArrayList<Double>(bins.size());
    var scheduled = new ArrayList<Double>(bins.size());
    var earned = new ArrayList<Double>(bins.size());
    double baselineTotal = 0;
    double scheduledTotal = 0;
    double earnedTotal = 0;
    for (int i = 0; i < bins.size(); i++) {
      var bin = bins.get(i);
      baselineTotal += baselinePerBin[i];
      scheduledTotal += scheduledPerBin[i];
      if (!bin.end().isAfter(today)) {
        earnedTotal += earnedPerBin[i];
      }
      labels.add(bin.end());
      baseline.add(Hours.round(baselineTotal));
      scheduled.add(Hours.round(scheduledTotal));
      earned.add(Hours.round(earnedTotal));
    }
    return new SCurve(labels, baseline, scheduled, earned, null);
  }

  static List<DateBin> bins(LocalDate axisStart, LocalDate axisEnd, int binDays) {
    var bins = new ArrayList<DateBin>();
    var binStart = axisStart;
    while (!binStart.isAfter(axisEnd)) {
      var binEnd = binStart.plusDays(binDays - 1L);
      bins.add(new DateBin(binStart, binEnd.isAfter(axisEnd) ? axisEnd : binEnd));
      binStart = binStart.plusDays(binDays);
    }
    return bins;
  }

  private static double[] spread(
      List<Task> tasks, List<DateBin> bins, ToDoubleFunction<Task> hours) {
    double[] perBin = new double[bins.size()];
    for (var task : tasks) {
      double taskHours = hours.applyAsDouble(task);
      if (taskHours == 0) {
        continue;
      }
      for (int i = 0; i < bins.size(); i++) {
        var bin = bins.get(i);
        perBin[i] +=
            taskHours
                * IntervalSpread.share(task.startDate(), task.finishDate(), bin.start(), bin.end());
      }
    }
    return perBin;
  }

  record DateBin(LocalDate start, LocalDate end) {
    DateBin {
      Objects.requireNonNull(start);
      Objects.requireNonNull(end);
    }
  }
}
