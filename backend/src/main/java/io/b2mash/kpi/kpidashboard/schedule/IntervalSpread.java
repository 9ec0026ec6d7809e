package io.b2mash.kpi.kpidashboard.schedule;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Linear spread of a quantity over a task's inclusive {@code [start, finish]} calendar days. Shared
 * by the S-curve and the resource load views so both bucket hours identically.
 */
public final class IntervalSpread {

  private IntervalSpread() {}

  /**
   * Fraction of the task's days that fall inside the inclusive window {@code [from, to]}. A
   * single-day task is wholly inside whichever window contains that day.
   */
  public static double share(LocalDate start, LocalDate finish, LocalDate from, LocalDate to) {
    if (start == null || finish == null) {
      return 0.0;
    }
    LocalDate overlapStart = start.isAfter(from) ? start : from;
    LocalDate overlapEnd = finish.isBefore(to) ? finish : to;
    if (overlapEnd.isBefore(overlapStart)) {
      return 0.0;
    }
    long taskDays = ChronoUnit.DAYS.between(start, finish) + 1;
    long overlapDays = ChronoUnit.DAYS.between(overlapStart, overlapEnd) + 1;
    return (double) overlapDays / taskDays;
  }
}
