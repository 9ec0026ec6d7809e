package io.b2mash.kpi.kpidashboard.baseline;

import java.math.BigDecimal;

/**
 * Totals over leaf tasks only, so that roll-ups do not count their children twice.
 *
 * @param tasksChanged tasks present on both sides whose tracked values differ
 */
public record ComparisonSummary(
    int tasksChanged,
    int tasksAdded,
    int tasksRemoved,
    BigDecimal totalCurrentHours,
    BigDecimal totalBaselineHours,
    BigDecimal hoursDelta) {}
