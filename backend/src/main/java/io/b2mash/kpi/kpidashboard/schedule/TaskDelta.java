package io.b2mash.kpi.kpidashboard.schedule;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Authoritative leaf inputs changed by one edit. A null component means "keep the current value".
 * An explicit {@code finishDate} suppresses finish-date projection.
 */
public record TaskDelta(
    BigDecimal workHours, Integer percentComplete, LocalDate startDate, LocalDate finishDate) {

  public static TaskDelta none() {
    return new TaskDelta(null, null, null, null);
  }

  public static TaskDelta workHours(BigDecimal workHours) {
    return new TaskDelta(workHours, null, null, null);
  }

  public static TaskDelta percentComplete(int percentComplete) {
    return new TaskDelta(null, percentComplete, null, null);
  }

  /** True when the edit touches an input the finish-date projection depends on. */
  boolean movesProjection() {
    return workHours != null || percentComplete != null || startDate != null;
  }
}
