package io.b2mash.kpi.kpidashboard.resourceload;

import java.util.List;

/**
 * One resource's hours over the report window. Field names are part of the charting contract.
 *
 * @param capacity capacity over the whole window
 * @param periods hours falling in each period of the window, in window order
 * @param overallocated true when any single period exceeds the per-period capacity
 */
public record ResourceLoadRow(
    String name,
    double capacity,
    double completed,
    double remaining,
    double available,
    double utilization,
    boolean overallocated,
    double capacityPerPeriod,
    List<Double> periods) {}
