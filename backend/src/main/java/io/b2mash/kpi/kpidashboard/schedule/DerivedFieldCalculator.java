package io.b2mash.kpi.kpidashboard.schedule;

import io.b2mash.kpi.kpidashboard.exception.InvalidStateException;
import io.b2mash.kpi.kpidashboard.task.Task;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Recomputes one leaf task's derived fields from its authoritative inputs. Pure utility class with
 * no Spring dependencies; both the persisting edit path and the what-if simulator call {@link
 * #recalculate}, so the projection rules exist exactly once.
 *
 * <ul>
 *   <li>{@code hoursCompleted = round(work × percent / 100)}, {@code hoursRemaining = work −
 *       hoursCompleted}
 *   <li>{@code earnedValue = round(baseline × percent / 100)}, {@code variance = work −
 *       baseline}
 *   <li>finish date: start advanced by {@code ceil(remaining / 8)} business days while work
 *       remains; unchanged once nothing remains (it then records actual completion)
 * </ul>
 */
public final class DerivedFieldCalculator {

  static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(8);

  private DerivedFieldCalculator() {}

  /**
   * Applies {@code delta} to {@code task} and returns the fully derived result. The input is not
   * modified.
   *
   * @throws InvalidStateException if work hours are not positive or exceed {@link
   *     Hours#MAX_TASK_HOURS}, percent is outside [0, 100], or
   *     an explicit finish date precedes the start date
   */
  public static Task recalculate(Task task, TaskDelta delta) {
    BigDecimal work =
        Hours.round(delta.workHours() != null ? delta.workHours() : task.workHours());
    int percent =
        delta.percentComplete() != null ? delta.percentComplete() : task.percentComplete();
    LocalDate start = delta.startDate() != null ? delta.startDate() : task.startDate();
    LocalDate finish = delta.finishDate() != null ? delta.finishDate() : task.finishDate();

    requirePositiveWork(work);
    requireValidPercent(percent);
    if (start == null) {
      throw new InvalidStateException("Invalid dates", "Task start date is required");
    }
    if (delta.finishDate() != null && finish.isBefore(start)) {
      throw new InvalidStateException(
          "Invalid dates", "Finish date " + finish + " is before start date " + start);
    }

    BigDecimal completed = Hours.percentOf(work, percent);
    BigDecimal remaining = work.subtract(completed);

    if (delta.finishDate() == null && delta.movesProjection() && remaining.signum() > 0) {
      finish = projectFinish(start, remaining);
    }
    if (finish == null || finish.isBefore(start)) {
      finish = start;
    }

    return task.toBuilder()
        .workHours(work)
        .percentComplete(percent)
        .startDate(start)
        .finishDate(finish)
        .hoursCompleted(completed)
        .hoursRemaining(remaining)
        .earnedValue(Hours.percentOf(task.baselineHours(), percent))
        .variance(work.subtract(task.baselineHours()))
        .build();
  }

  /** Finish date for {@code remaining} hours of work starting at {@code start}. */
  public static LocalDate projectFinish(LocalDate start, BigDecimal remaining) {
    long remainingDays =
        remaining.divide(HOURS_PER_DAY, 0, RoundingMode.CEILING).longValueExact();
    return BusinessDays.advance(start, remainingDays);
  }

  public static void requirePositiveWork(BigDecimal workHours) {
    if (workHours == null || workHours.signum() <= 0) {
      throw new InvalidStateException(
          "Invalid work hours", "Work hours must be greater than 0, but got: " + workHours);
    }
    if (workHours.compareTo(Hours.MAX_TASK_HOURS) > 0) {
      throw new InvalidStateException(
          "Invalid work hours",
          "Work hours must not exceed " + Hours.MAX_TASK_HOURS + ", but got: " + workHours);
    }
  }

  public static void requireValidPercent(int percent) {
    if (percent < 0 || percent > 100) {
      throw new InvalidStateException(
          "Invalid percent complete",
          "Percent complete must be between 0 and 100, but got: " + percent);
    }
  }
}
