package io.b2mash.kpi.kpidashboard.resourceload;

import java.time.LocalDate;
import java.util.List;

public record ResourceLoadReport(
    LoadPeriod period,
    LoadView view,
    List<String> labels,
    List<LocalDate> periodStarts,
    List<ResourceLoadRow> resources) {}
