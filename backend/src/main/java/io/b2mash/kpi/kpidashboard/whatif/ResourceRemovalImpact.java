package io.b2mash.kpi.kpidashboard.whatif;

import java.math.BigDecimal;
import java.util.List;

/**
 * Projected effect of losing a resource.
 *
 * @param removedResource the resource taken out
 * @param affectedTasks open leaf tasks the resource held
 * @param orphanedHours remaining hours still without an owner after any redistribution
 * @param redistribution proposed placements, empty when redistribution was not requested
 */
public record ResourceRemovalImpact(
    String removedResource,
    int affectedTasks,
    BigDecimal orphanedHours,
    List<Reassignment> redistribution) {}
