package io.b2mash.kpi.kpidashboard.resource;

import io.b2mash.kpi.kpidashboard.resourceload.LoadPeriod;
import java.math.BigDecimal;

/**
 * A person tasks are assigned to. Tasks reference resources by name.
 *
 * @param name unique resource name
 * @param capacityHoursPerWeek hours this resource can carry per week
 * @param active inactive resources keep their tasks but drop out of load reports and
 *     redistribution
 * @param leadPreference defaults for phase rescaling and creation ratios
 */
public record Resource(
    String name, BigDecimal capacityHoursPerWeek, boolean active, LeadPreference leadPreference) {

  public BigDecimal capacityFor(LoadPeriod period) {
    return capacityHoursPerWeek.multiply(BigDecimal.valueOf(period.weeksPerPeriod()));
  }
}
