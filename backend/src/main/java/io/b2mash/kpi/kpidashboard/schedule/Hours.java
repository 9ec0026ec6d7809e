package io.b2mash.kpi.kpidashboard.schedule;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Hour quantities are kept to one decimal place, rounded half-up. */
public final class Hours {

  public static final int SCALE = 1;
  public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  /** Upper bound for one task's work hours; about four centuries of eight-hour days. */
  public static final BigDecimal MAX_TASK_HOURS = BigDecimal.valueOf(1_000_000);

  private Hours() {}

  public static BigDecimal round(BigDecimal hours) {
    return hours.setScale(SCALE, RoundingMode.HALF_UP);
  }

  public static BigDecimal of(double hours) {
    return round(BigDecimal.valueOf(hours));
  }

  /** {@code hours × percent / 100}, rounded. */
  public static BigDecimal percentOf(BigDecimal hours, int percent) {
    return round(hours.multiply(BigDecimal.valueOf(percent)).divide(HUNDRED));
  }

  /** Rounds a chart value to one decimal. */
  public static double round(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
