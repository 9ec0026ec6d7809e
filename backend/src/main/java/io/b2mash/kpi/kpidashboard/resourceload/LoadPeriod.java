package io.b2mash.kpi.kpidashboard.resourceload;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/** Bucket width of the resource load window. A month counts as four weeks of capacity. */
public enum LoadPeriod {
  WEEK(1) {
    @Override
    public LocalDate periodStart(LocalDate date) {
      return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    @Override
    public LocalDate next(LocalDate periodStart) {
      return periodStart.plusWeeks(1);
    }

    @Override
    public String label(LocalDate periodStart) {
      return "Wk " + periodStart.format(WEEK_LABEL);
    }
  },
  MONTH(4) {
    @Override
    public LocalDate periodStart(LocalDate date) {
      return date.withDayOfMonth(1);
    }

    @Override
    public LocalDate next(LocalDate periodStart) {
      return periodStart.plusMonths(1);
    }

    @Override
    public String label(LocalDate periodStart) {
      return periodStart.format(MONTH_LABEL);
    }
  };

  private static final DateTimeFormatter WEEK_LABEL = DateTimeFormatter.ofPattern("MM/dd");
  private static final DateTimeFormatter MONTH_LABEL =
      DateTimeFormatter.ofPattern("MMM ''yy", Locale.ENGLISH);

  private final int weeksPerPeriod;

  LoadPeriod(int weeksPerPeriod) {
    this.weeksPerPeriod = weeksPerPeriod;
  }

  public int weeksPerPeriod() {
    return weeksPerPeriod;
  }

  /** First day of the period containing {@code date}. */
  public abstract LocalDate periodStart(LocalDate date);

  /** First day of the period after the one starting at {@code periodStart}. */
  public abstract LocalDate next(LocalDate periodStart);

  public abstract String label(LocalDate periodStart);
}
