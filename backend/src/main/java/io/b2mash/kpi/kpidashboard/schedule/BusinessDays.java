package io.b2mash.kpi.kpidashboard.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;

/** Weekday arithmetic. Saturdays and Sundays are the only non-working days. */
public final class BusinessDays {

  private BusinessDays() {}

  public static boolean isBusinessDay(LocalDate date) {
    var day = date.getDayOfWeek();
    return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
  }

  /**
   * Steps forward from {@code anchor} until {@code days} business days have been passed. The
   * anchor itself is never counted, so the result is strictly after the anchor for {@code days >
   * 0} and equal to it otherwise.
   */
  public static LocalDate advance(LocalDate anchor, long days) {
    if (days <= 0) {
      return anchor;
    }
    // a weekend anchor behaves like the Friday before it
    var current = anchor;
    while (!isBusinessDay(current)) {
      current = current.minusDays(1);
    }
    // five business days from any weekday land on the same weekday a week later
    current = current.plusWeeks(days / 5);
    long counted = 0;
    while (counted < days % 5) {
      current = current.plusDays(1);
      if (isBusinessDay(current)) {
        counted++;
      }
    }
    return current;
  }
}
