package io.b2mash.kpi.kpidashboard.baseline;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One task compared between a baseline and the live state. All deltas are {@code current −
 * baseline} and are null when the task exists on one side only.
 */
public record TaskComparison(
    UUID taskId,
    String task,
    BaselineChange change,
    BigDecimal baselineWorkHours,
    BigDecimal currentWorkHours,
    BigDecimal hoursDelta,
    Integer pctDelta,
    BigDecimal varianceDelta,
    LocalDate baselineFinish,
    LocalDate currentFinish,
    Long scheduleSlipDays) {}
