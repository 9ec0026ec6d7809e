package io.b2mash.kpi.kpidashboard.baseline;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Frozen copy of the tracked fields of one task.
 *
 * @param rollup true when the task had subtasks at capture time; roll-ups are left out of totals
 */
public record TaskCapture(
    String taskName,
    BigDecimal workHours,
    int percentComplete,
    LocalDate finishDate,
    BigDecimal variance,
    boolean rollup) {}
