package io.b2mash.kpi.kpidashboard.whatif;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** How a parent task would re-aggregate if one of its descendants grew. */
public record AncestorProjection(
    UUID taskId,
    String task,
    BigDecimal currentWorkHours,
    BigDecimal projectedWorkHours,
    LocalDate currentFinish,
    LocalDate projectedFinish) {}
