package io.b2mash.kpi.kpidashboard.whatif;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record AddHoursImpact(
    UUID taskId,
    String task,
    BigDecimal extraHours,
    int percentComplete,
    BigDecimal currentWorkHours,
    BigDecimal projectedWorkHours,
    BigDecimal currentRemaining,
    BigDecimal projectedRemaining,
    BigDecimal currentVariance,
    BigDecimal projectedVariance,
    LocalDate currentFinish,
    LocalDate projectedFinish,
    List<AncestorProjection> ancestors) {}
