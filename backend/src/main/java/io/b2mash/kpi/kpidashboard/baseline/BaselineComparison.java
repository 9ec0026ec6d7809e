package io.b2mash.kpi.kpidashboard.baseline;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BaselineComparison(
    UUID baselineId,
    String baselineName,
    BaselineType type,
    Instant capturedAt,
    ComparisonSummary summary,
    List<TaskComparison> tasks) {}
