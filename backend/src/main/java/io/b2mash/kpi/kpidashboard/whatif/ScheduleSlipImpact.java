package io.b2mash.kpi.kpidashboard.whatif;

import java.time.LocalDate;
import java.util.List;

public record ScheduleSlipImpact(
    int weeksSlipped,
    int tasksAffected,
    LocalDate currentLatestFinish,
    LocalDate projectedLatestFinish,
    List<SlippedTask> changes) {}
