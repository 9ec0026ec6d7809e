package io.b2mash.kpi.kpidashboard.whatif;

import java.time.LocalDate;
import java.util.UUID;

public record SlippedTask(
    UUID taskId,
    String task,
    String resource,
    int percentComplete,
    LocalDate oldStart,
    LocalDate newStart,
    LocalDate oldFinish,
    LocalDate newFinish) {}
